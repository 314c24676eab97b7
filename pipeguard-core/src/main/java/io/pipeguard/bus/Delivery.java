package io.pipeguard.bus;

import java.time.Instant;
import java.util.Objects;

/**
 * One delivery of a queued message to a consumer.
 *
 * @param messageId     bus-assigned id, stable across redeliveries
 * @param queue         queue the message was fetched from
 * @param routingKey    routing key it was published with
 * @param body          encoded envelope
 * @param deliveryCount number of times the message has been handed out, including this one
 * @param enqueuedAt    time the message was first queued
 */
public record Delivery(String messageId, String queue, String routingKey, String body,
                       int deliveryCount, Instant enqueuedAt) {

    public Delivery {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(queue, "queue");
    }

    public boolean isRedelivery() {
        return deliveryCount > 1;
    }
}
