package io.pipeguard.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe table of {@link EventSchema}s keyed by {@code (type, version)}.
 *
 * <p>Each key resolves to exactly one schema: registering a key twice is rejected.
 *
 * @see PipelineEvents#registry()
 */
public final class SchemaRegistry {

    /** Registry key. */
    public record Key(String type, String version) {
        public Key {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(version, "version");
        }

        @Override
        public String toString() {
            return type + " v" + version;
        }
    }

    private final Map<Key, EventSchema> schemas = new ConcurrentHashMap<>();

    /**
     * Registers a schema.
     *
     * @return this registry
     * @throws IllegalArgumentException if a schema is already registered for the pair
     */
    public SchemaRegistry register(String type, String version, EventSchema schema) {
        Objects.requireNonNull(schema, "schema");
        Key key = new Key(type, version);
        if (schemas.putIfAbsent(key, schema) != null) {
            throw new IllegalArgumentException("Schema already registered for " + key);
        }
        return this;
    }

    public Optional<EventSchema> lookup(String type, String version) {
        if (type == null || version == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(new Key(type, version)));
    }

    public boolean isRegistered(String type, String version) {
        return lookup(type, version).isPresent();
    }

    public Set<Key> keys() {
        return Set.copyOf(schemas.keySet());
    }

    /**
     * Validates the envelope's data against its registered schema.
     *
     * @return the validated data (a copy)
     * @throws ValidationException if the pair is unknown or the data does not conform
     */
    public ObjectNode validate(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        EventSchema schema = schemas.get(new Key(envelope.type(), envelope.version()));
        if (schema == null) {
            throw new ValidationException(envelope.type(), envelope.version(),
                    List.of("unknown event type/version"));
        }
        ObjectNode data = envelope.data();
        List<String> errors = schema.validate(data);
        if (!errors.isEmpty()) {
            throw new ValidationException(envelope.type(), envelope.version(), errors);
        }
        return data;
    }
}
