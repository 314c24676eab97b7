package io.pipeguard;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Immutable wire unit carried on the message bus.
 *
 * <p>An envelope is tagged by {@code (type, version)}; its {@code data} object must validate
 * against the schema registered for that pair before it is published or handed to application
 * code. The {@code id} defaults to a monotonic ULID and identifies the message, not the entity
 * it describes, so republishing the same work under a new id is expected.
 *
 * @see io.pipeguard.schema.SchemaRegistry
 * @see io.pipeguard.schema.EnvelopeCodec
 */
public final class Envelope {
    public static final String DEFAULT_VERSION = "1.0";

    private final String type;
    private final String version;
    private final String id;
    private final Instant timestamp;
    private final ObjectNode data;

    private Envelope(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        this.version = builder.version == null ? DEFAULT_VERSION : builder.version;
        this.id = builder.id == null ? newId() : builder.id;
        // Wire format carries millisecond precision at most
        this.timestamp = (builder.timestamp == null ? Instant.now() : builder.timestamp)
                .truncatedTo(ChronoUnit.MILLIS);
        ObjectNode source = Objects.requireNonNull(builder.data, "data");
        this.data = source.deepCopy();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType.typeName()).version(eventType.version());
    }

    /**
     * Creates an envelope for the given event type with a fresh id and the current time.
     */
    public static Envelope of(EventType eventType, ObjectNode data) {
        return builder(eventType).data(data).build();
    }

    private static String newId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    public String type() {
        return type;
    }

    public String version() {
        return version;
    }

    public String id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns a copy of the payload. Mutating it does not affect this envelope.
     */
    public ObjectNode data() {
        return data.deepCopy();
    }

    /**
     * Reads a text field of {@code data}, or {@code null} if absent or not textual.
     */
    public String text(String field) {
        var node = data.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /**
     * Copies type, version and data into a builder that will mint a new id and timestamp.
     */
    public Builder toRepublishBuilder() {
        return new Builder(type).version(version).data(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope other)) return false;
        return type.equals(other.type) && version.equals(other.version) && id.equals(other.id)
                && timestamp.equals(other.timestamp) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, version, id);
    }

    @Override
    public String toString() {
        return "Envelope{type=" + type + ", version=" + version + ", id=" + id + "}";
    }

    /** Builder for {@link Envelope}. */
    public static final class Builder {
        private final String type;
        private String version;
        private String id;
        private Instant timestamp;
        private ObjectNode data;

        private Builder(String type) {
            this.type = type;
        }

        /**
         * Sets the schema version.
         *
         * <p>Optional. Defaults to {@value Envelope#DEFAULT_VERSION}.
         */
        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Sets the message id.
         *
         * <p>Optional. Defaults to a new monotonic ULID.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the emission time.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Sets the payload. The object is copied on {@link #build()}.
         *
         * <p><b>Required.</b>
         */
        public Builder data(ObjectNode data) {
            this.data = data;
            return this;
        }

        public Envelope build() {
            return new Envelope(this);
        }
    }
}
