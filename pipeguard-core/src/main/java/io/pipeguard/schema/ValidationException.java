package io.pipeguard.schema;

import java.util.List;

/**
 * Raised when an envelope is malformed: it cannot be decoded, its {@code (type, version)} is
 * not registered, or its data does not conform to the registered schema.
 *
 * <p>Always a permanent failure; the subscriber drops such messages without invoking
 * application code.
 */
public final class ValidationException extends RuntimeException {
    private final String eventType;
    private final String version;
    private final List<String> errors;

    public ValidationException(String eventType, String version, List<String> errors) {
        this(eventType, version, errors, null);
    }

    public ValidationException(String eventType, String version, List<String> errors, Throwable cause) {
        super(buildMessage(eventType, version, errors), cause);
        this.eventType = eventType;
        this.version = version;
        this.errors = List.copyOf(errors);
    }

    private static String buildMessage(String eventType, String version, List<String> errors) {
        return "Invalid " + (eventType == null ? "envelope" : eventType + " v" + version) + ": "
                + String.join("; ", errors);
    }

    /** Envelope type, or {@code null} when the envelope could not be decoded that far. */
    public String eventType() {
        return eventType;
    }

    public String version() {
        return version;
    }

    public List<String> errors() {
        return errors;
    }
}
