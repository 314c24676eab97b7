package io.pipeguard.stage;

import io.pipeguard.EventType;

import java.util.Objects;
import java.util.Optional;

/**
 * A pipeline stage as seen by the reliability core: the event that triggers it, the failure
 * event it emits when a unit of work is abandoned, and the data field naming that unit.
 *
 * @param name       stage name used in logs and metric tags, e.g. {@code "Parsing"}
 * @param inputEvent event consumed by the stage, or {@code null} for a source stage
 * @param failedEvent failure event emitted on exhaustion or permanent failure
 * @param idField    data field carrying the content-derived id of the unit of work
 */
public record StageDescriptor(String name, EventType inputEvent, EventType failedEvent, String idField) {

    public StageDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(failedEvent, "failedEvent");
        Objects.requireNonNull(idField, "idField");
        if (!failedEvent.isFailure()) {
            throw new IllegalArgumentException("failedEvent must use a .failed routing key: "
                    + failedEvent.routingKey());
        }
    }

    public Optional<EventType> input() {
        return Optional.ofNullable(inputEvent);
    }

    /** Whether messages from this stage's failed queue can be replayed into its input. */
    public boolean isReplayable() {
        return inputEvent != null;
    }
}
