package io.pipeguard.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural schema for the {@code data} object of one {@code (type, version)}.
 *
 * <p>Checks presence of required fields, JSON value types, enumerated string values and
 * array item types. Fields not declared by the schema are accepted so producers can add
 * optional context without a version bump.
 */
public final class EventSchema {

    /**
     * Declaration of one field.
     *
     * @param name          JSON property name
     * @param type          expected value type
     * @param required      whether the field must be present and non-null
     * @param allowedValues permitted string values, empty when unrestricted
     * @param itemType      item type for {@link FieldType#ARRAY} fields, or {@code null}
     */
    public record Field(String name, FieldType type, boolean required, Set<String> allowedValues,
                        FieldType itemType) {
    }

    private final Map<String, Field> fields;

    private EventSchema(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Field> fields() {
        return fields;
    }

    public Set<String> requiredFields() {
        Set<String> required = new LinkedHashSet<>();
        for (Field field : fields.values()) {
            if (field.required()) {
                required.add(field.name());
            }
        }
        return required;
    }

    /**
     * Validates a payload.
     *
     * @return human-readable errors, empty when the payload conforms
     */
    public List<String> validate(ObjectNode data) {
        if (data == null) {
            return List.of("data: must be an object");
        }
        List<String> errors = new ArrayList<>();
        for (Field field : fields.values()) {
            JsonNode value = data.get(field.name());
            if (value == null || value.isNull()) {
                if (field.required()) {
                    errors.add(field.name() + ": required field is missing");
                }
                continue;
            }
            if (!field.type().matches(value)) {
                errors.add(field.name() + ": expected " + field.type().jsonName()
                        + " but got " + value.getNodeType().name().toLowerCase());
                continue;
            }
            if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(value.asText())) {
                errors.add(field.name() + ": '" + value.asText() + "' is not one of " + field.allowedValues());
            }
            if (field.itemType() != null) {
                for (int i = 0; i < value.size(); i++) {
                    if (!field.itemType().matches(value.get(i))) {
                        errors.add(field.name() + "[" + i + "]: expected " + field.itemType().jsonName());
                    }
                }
            }
        }
        return errors;
    }

    /** Builder for {@link EventSchema}. */
    public static final class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, FieldType type) {
            return add(new Field(name, type, true, Set.of(), null));
        }

        public Builder optional(String name, FieldType type) {
            return add(new Field(name, type, false, Set.of(), null));
        }

        public Builder requiredEnum(String name, String... allowedValues) {
            return add(new Field(name, FieldType.STRING, true, orderedSet(allowedValues), null));
        }

        public Builder optionalEnum(String name, String... allowedValues) {
            return add(new Field(name, FieldType.STRING, false, orderedSet(allowedValues), null));
        }

        public Builder requiredArrayOf(String name, FieldType itemType) {
            return add(new Field(name, FieldType.ARRAY, true, Set.of(), itemType));
        }

        public Builder optionalArrayOf(String name, FieldType itemType) {
            return add(new Field(name, FieldType.ARRAY, false, Set.of(), itemType));
        }

        private Builder add(Field field) {
            Objects.requireNonNull(field.name(), "name");
            Objects.requireNonNull(field.type(), "type");
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Field declared twice: " + field.name());
            }
            return this;
        }

        private static Set<String> orderedSet(String... values) {
            if (values.length == 0) {
                throw new IllegalArgumentException("enum field needs at least one allowed value");
            }
            return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
        }

        public EventSchema build() {
            return new EventSchema(this);
        }
    }
}
