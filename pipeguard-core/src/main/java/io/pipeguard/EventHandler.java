package io.pipeguard;

/**
 * Application callback invoked by the validating subscriber for one validated envelope.
 *
 * <p>Implementations return a {@link HandlerResult}. An exception that escapes anyway is
 * classified by the subscriber's {@link io.pipeguard.ack.FailureClassifier}.
 */
@FunctionalInterface
public interface EventHandler {

    HandlerResult onEvent(Envelope envelope) throws Exception;
}
