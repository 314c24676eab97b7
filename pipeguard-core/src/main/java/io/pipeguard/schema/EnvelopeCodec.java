package io.pipeguard.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.util.Jsons;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts envelopes to and from their wire JSON:
 *
 * <pre>{@code
 * {"type": "JSONParsed", "version": "1.0", "id": "01J...", "timestamp": "2025-01-01T00:00:00Z",
 *  "data": {...}}
 * }</pre>
 *
 * <p>Timestamps are written as RFC 3339 in UTC and accepted with any offset. Decoding does
 * not consult the schema registry; it only checks the envelope shape.
 */
public final class EnvelopeCodec {
    private static final String[] ENVELOPE_FIELDS = {"type", "version", "id", "timestamp"};

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(Jsons.mapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Envelope envelope) {
        return Jsons.toJson(toNode(envelope));
    }

    public ObjectNode toNode(Envelope envelope) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", envelope.type());
        node.put("version", envelope.version());
        node.put("id", envelope.id());
        node.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(envelope.timestamp()));
        node.set("data", envelope.data());
        return node;
    }

    /**
     * Decodes wire JSON into an envelope.
     *
     * @throws ValidationException if the body is not JSON or lacks a well-formed envelope field
     */
    public Envelope decode(String body) {
        JsonNode root;
        try {
            root = body == null ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException(null, null, List.of("body is not valid JSON: " + e.getOriginalMessage()), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(null, null, List.of("body is not a JSON object"));
        }
        return fromNode((ObjectNode) root);
    }

    public Envelope fromNode(ObjectNode root) {
        String type = textOrNull(root, "type");
        String version = textOrNull(root, "version");

        List<String> errors = new ArrayList<>();
        for (String field : ENVELOPE_FIELDS) {
            String value = textOrNull(root, field);
            if (value == null || value.isBlank()) {
                errors.add(field + ": required envelope field is missing");
            }
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            errors.add("data: must be an object");
        }
        Instant timestamp = null;
        String rawTimestamp = textOrNull(root, "timestamp");
        if (rawTimestamp != null && !rawTimestamp.isBlank()) {
            try {
                timestamp = OffsetDateTime.parse(rawTimestamp).toInstant();
            } catch (DateTimeParseException e) {
                errors.add("timestamp: not an RFC 3339 date-time");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(type, version, errors);
        }
        return Envelope.builder(type)
                .version(version)
                .id(root.get("id").asText())
                .timestamp(timestamp)
                .data((ObjectNode) data)
                .build();
    }

    private static String textOrNull(ObjectNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
