package io.pipeguard;

/**
 * Classification of a failed unit of work.
 *
 * <p>The acknowledgment policy switches on this value; it never inspects exception types.
 */
public enum FailureKind {
    /** The message itself is unusable (schema mismatch, undecodable payload). Never retried. */
    MALFORMED,
    /** Business-rule or referential-integrity violation. Redelivery cannot help. */
    PERMANENT,
    /** Infrastructure hiccup (timeout, refused connection, exhausted resources). Worth redelivering. */
    TRANSIENT
}
