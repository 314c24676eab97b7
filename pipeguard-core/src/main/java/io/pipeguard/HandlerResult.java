package io.pipeguard;

import java.util.Objects;

/**
 * Outcome returned by an {@link EventHandler} or the retry executor.
 *
 * <p>Handlers report failures through {@link Failed} rather than by letting an exception
 * escape, so the acknowledgment decision is made from an explicit classification.
 *
 * @see io.pipeguard.ack.AcknowledgmentPolicy
 */
public sealed interface HandlerResult permits HandlerResult.Done, HandlerResult.Failed {

    /** Shared success instance. */
    HandlerResult DONE = new Done();

    static HandlerResult done() {
        return DONE;
    }

    static HandlerResult failed(FailureKind kind, Throwable cause) {
        return new Failed(kind, cause);
    }

    static HandlerResult malformed(Throwable cause) {
        return new Failed(FailureKind.MALFORMED, cause);
    }

    static HandlerResult permanent(Throwable cause) {
        return new Failed(FailureKind.PERMANENT, cause);
    }

    static HandlerResult transientFailure(Throwable cause) {
        return new Failed(FailureKind.TRANSIENT, cause);
    }

    default boolean isDone() {
        return this instanceof Done;
    }

    /** The unit of work completed (or had already completed earlier). */
    record Done() implements HandlerResult {
    }

    /**
     * The unit of work failed.
     *
     * @param kind  failure classification, never null
     * @param cause underlying error, may be null
     */
    record Failed(FailureKind kind, Throwable cause) implements HandlerResult {
        public Failed {
            Objects.requireNonNull(kind, "kind");
        }

        public String errorType() {
            return cause == null ? kind.name() : cause.getClass().getSimpleName();
        }

        public String errorMessage() {
            if (cause == null) {
                return kind.name();
            }
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        }
    }
}
