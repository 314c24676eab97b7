package io.pipeguard.retry;

import io.pipeguard.HandlerResult;

/**
 * One attempt at the work a handler performs for a message.
 *
 * <p>Return {@link HandlerResult#done()} on success or a classified
 * {@link HandlerResult.Failed}; a thrown exception is classified by the executor's
 * {@link io.pipeguard.ack.FailureClassifier}.
 */
@FunctionalInterface
public interface UnitOfWork {

    HandlerResult perform() throws Exception;
}
