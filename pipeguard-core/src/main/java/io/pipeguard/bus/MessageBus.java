package io.pipeguard.bus;

import java.util.List;

/**
 * At-least-once message bus with named queues bound to routing keys.
 *
 * <p>A fetched message stays invisible to other consumers until it is acknowledged or
 * negatively acknowledged. Implementations may redeliver a message whose consumer vanished
 * without doing either, so a message can be seen more than once.
 *
 * @see InMemoryMessageBus
 */
public interface MessageBus {

    /**
     * Routes a message to every queue bound to the routing key.
     *
     * @return number of queues the message was written to; zero means it was discarded
     */
    int publish(String routingKey, String body);

    /**
     * Claims up to {@code limit} messages from a queue, oldest first.
     */
    List<Delivery> fetch(String queue, String consumerId, int limit);

    /**
     * Removes a delivered message permanently.
     */
    void ack(Delivery delivery);

    /**
     * Releases a delivered message. With {@code requeue} it becomes available again;
     * otherwise it is discarded.
     */
    void nack(Delivery delivery, boolean requeue);

    /**
     * Returns up to {@code limit} ready messages without claiming them.
     */
    List<Delivery> peek(String queue, int limit);

    /**
     * Number of messages held by the queue, claimed or not.
     */
    int depth(String queue);

    Topology topology();
}
