package io.pipeguard;

/**
 * A named, versioned event with the routing key it is published under.
 *
 * <p>The standard pipeline catalogue is {@link io.pipeguard.schema.PipelineEvents}.
 */
public interface EventType {

    /** Envelope {@code type} discriminator, e.g. {@code "JSONParsed"}. */
    String typeName();

    /** Schema version carried in the envelope. */
    default String version() {
        return Envelope.DEFAULT_VERSION;
    }

    /** Routing key of the form {@code <domain>.<action>} or {@code <domain>.<action>.failed}. */
    String routingKey();

    default boolean isFailure() {
        return routingKey().endsWith(".failed");
    }
}
