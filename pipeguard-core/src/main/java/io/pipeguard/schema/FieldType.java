package io.pipeguard.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * JSON value types a schema field may declare.
 */
public enum FieldType {
    STRING {
        @Override
        boolean matches(JsonNode node) {
            return node.isTextual();
        }
    },
    INTEGER {
        @Override
        boolean matches(JsonNode node) {
            return node.isIntegralNumber();
        }
    },
    NUMBER {
        @Override
        boolean matches(JsonNode node) {
            return node.isNumber();
        }
    },
    BOOLEAN {
        @Override
        boolean matches(JsonNode node) {
            return node.isBoolean();
        }
    },
    OBJECT {
        @Override
        boolean matches(JsonNode node) {
            return node.isObject();
        }
    },
    ARRAY {
        @Override
        boolean matches(JsonNode node) {
            return node.isArray();
        }
    },
    /** RFC 3339 date-time string with an explicit offset. */
    TIMESTAMP {
        @Override
        boolean matches(JsonNode node) {
            if (!node.isTextual()) {
                return false;
            }
            try {
                OffsetDateTime.parse(node.asText());
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    };

    abstract boolean matches(JsonNode node);

    String jsonName() {
        return name().toLowerCase();
    }
}
