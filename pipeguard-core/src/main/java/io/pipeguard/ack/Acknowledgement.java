package io.pipeguard.ack;

/**
 * What the subscriber tells the bus about a delivery.
 */
public enum Acknowledgement {
    /** Processing finished; remove the message. */
    ACK,
    /** Processing may succeed later; make the message available again. */
    REQUEUE,
    /** Processing can never succeed; remove the message without retrying. */
    DROP
}
