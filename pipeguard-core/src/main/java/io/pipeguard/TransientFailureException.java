package io.pipeguard;

/**
 * Signals a failure that a later attempt may overcome.
 *
 * <p>Any {@link io.pipeguard.ack.FailureClassifier} treats this type as
 * {@link FailureKind#TRANSIENT} regardless of its configured rules.
 */
public class TransientFailureException extends RuntimeException {

    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
