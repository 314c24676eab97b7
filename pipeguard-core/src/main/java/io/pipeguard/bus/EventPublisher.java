package io.pipeguard.bus;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.EventType;

/**
 * Publishes envelopes onto the bus.
 *
 * @see ValidatingPublisher
 */
public interface EventPublisher {

    /**
     * Publishes an envelope under the given routing key.
     *
     * @throws io.pipeguard.schema.ValidationException if the envelope does not conform to its schema
     * @throws MessageBusException if the transport fails
     */
    void publish(String routingKey, Envelope envelope);

    /**
     * Publishes a new envelope of the given event type under its routing key.
     *
     * @return the published envelope
     */
    default Envelope publish(EventType eventType, ObjectNode data) {
        Envelope envelope = Envelope.of(eventType, data);
        publish(eventType.routingKey(), envelope);
        return envelope;
    }
}
