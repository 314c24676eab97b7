package io.pipeguard.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work advancing through the pipeline (archive, message, chunk, thread).
 *
 * @param collection      collection name, e.g. {@code "archives"}
 * @param id              content-derived id
 * @param status          lifecycle state
 * @param attemptCount    republish attempts made by the stuck-document scanner
 * @param lastAttemptTime time of the last scanner republish, or {@code null}
 * @param triggerData     data of the event that starts processing of this entity
 * @param createdAt       creation time
 */
public record TrackedEntity(String collection, String id, EntityStatus status, int attemptCount,
                            Instant lastAttemptTime, ObjectNode triggerData, Instant createdAt) {

    public TrackedEntity {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0");
        }
    }

    /**
     * A freshly created entity: pending, no attempts, never republished.
     */
    public static TrackedEntity pending(String collection, String id, ObjectNode triggerData, Instant createdAt) {
        return new TrackedEntity(collection, id, EntityStatus.PENDING, 0, null, triggerData, createdAt);
    }

    /**
     * The last republish, or creation if never republished. Orders stuck candidates.
     */
    public Instant lastActivity() {
        return lastAttemptTime != null ? lastAttemptTime : createdAt;
    }
}
