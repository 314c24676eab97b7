package io.pipeguard.dead;

/**
 * The queue is not bound to the failure routing key of any known stage.
 */
public class UnknownFailedQueueException extends RuntimeException {

    public UnknownFailedQueueException(String queue) {
        super("Unknown failed queue: " + queue);
    }
}
