package io.pipeguard;

/**
 * Signals a failure no retry can fix, such as a business-rule violation or a missing
 * upstream record.
 *
 * <p>Any {@link io.pipeguard.ack.FailureClassifier} treats this type as
 * {@link FailureKind#PERMANENT} regardless of its configured rules.
 */
public class PermanentFailureException extends RuntimeException {

    public PermanentFailureException(String message) {
        super(message);
    }

    public PermanentFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
