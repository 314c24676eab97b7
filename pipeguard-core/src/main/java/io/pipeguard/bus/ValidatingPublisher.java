package io.pipeguard.bus;

import io.pipeguard.Envelope;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.SchemaRegistry;
import io.pipeguard.schema.ValidationException;
import io.pipeguard.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventPublisher} that refuses to send any envelope its schema registry rejects.
 */
public final class ValidatingPublisher implements EventPublisher {
    private static final Logger logger = Logger.getLogger(ValidatingPublisher.class.getName());

    private final MessageBus bus;
    private final SchemaRegistry registry;
    private final EnvelopeCodec codec;
    private final MetricsExporter metrics;

    public ValidatingPublisher(MessageBus bus, SchemaRegistry registry) {
        this(bus, registry, new EnvelopeCodec(), MetricsExporter.NOOP);
    }

    public ValidatingPublisher(MessageBus bus, SchemaRegistry registry, EnvelopeCodec codec, MetricsExporter metrics) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    @Override
    public void publish(String routingKey, Envelope envelope) {
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(envelope, "envelope");
        try {
            registry.validate(envelope);
        } catch (ValidationException e) {
            metrics.incrementValidationFailure(envelope.type(), "publish");
            logger.log(Level.WARNING, "Refusing to publish invalid envelope id=" + envelope.id()
                    + " routing_key=" + routingKey + ": " + e.getMessage());
            throw e;
        }
        int routed = bus.publish(routingKey, codec.encode(envelope));
        if (routed == 0) {
            logger.log(Level.WARNING, "Envelope " + envelope.type() + " id=" + envelope.id()
                    + " was not routed to any queue (routing_key=" + routingKey + ")");
        }
    }
}
