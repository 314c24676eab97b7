package io.pipeguard.bus;

import io.pipeguard.EventType;
import io.pipeguard.schema.PipelineEvents;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable routing table from routing keys to queue names.
 *
 * @see TopologyVerifier
 */
public final class Topology {
    private final Map<String, List<String>> bindings;

    private Topology(Builder builder) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.bindings.forEach((key, queues) -> copy.put(key, List.copyOf(queues)));
        this.bindings = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds every routing key of the pipeline catalogue to a durable queue of the same name.
     */
    public static Topology standard() {
        Builder builder = builder();
        for (PipelineEvents event : PipelineEvents.values()) {
            builder.bind(event);
        }
        return builder.build();
    }

    public List<String> queuesFor(String routingKey) {
        return bindings.getOrDefault(routingKey, List.of());
    }

    public boolean isBound(String routingKey) {
        return !queuesFor(routingKey).isEmpty();
    }

    public Set<String> routingKeys() {
        return bindings.keySet();
    }

    public Set<String> queues() {
        Set<String> queues = new LinkedHashSet<>();
        bindings.values().forEach(queues::addAll);
        return queues;
    }

    /** Builder for {@link Topology}. */
    public static final class Builder {
        private final Map<String, Set<String>> bindings = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder bind(String routingKey, String queue) {
            Objects.requireNonNull(routingKey, "routingKey");
            Objects.requireNonNull(queue, "queue");
            bindings.computeIfAbsent(routingKey, k -> new LinkedHashSet<>()).add(queue);
            return this;
        }

        /** Binds the event's routing key to a queue of the same name. */
        public Builder bind(EventType event) {
            return bind(event.routingKey(), event.routingKey());
        }

        public Topology build() {
            return new Topology(this);
        }
    }
}
