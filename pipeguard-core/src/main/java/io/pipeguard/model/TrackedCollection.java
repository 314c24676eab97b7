package io.pipeguard.model;

import io.pipeguard.EventType;
import io.pipeguard.idempotency.IdempotencyContract;

import java.util.Objects;

/**
 * Configuration of one collection of tracked entities.
 *
 * @param name         collection name
 * @param maxAttempts  scanner attempt ceiling; reaching it marks the entity failed
 * @param triggerEvent event republished to restart processing of a stuck entity
 * @param contract     how writes for this entity type stay idempotent
 */
public record TrackedCollection(String name, int maxAttempts, EventType triggerEvent, IdempotencyContract contract) {

    public TrackedCollection {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(triggerEvent, "triggerEvent");
        Objects.requireNonNull(contract, "contract");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 for " + name);
        }
    }

    public TrackedCollection withMaxAttempts(int maxAttempts) {
        return new TrackedCollection(name, maxAttempts, triggerEvent, contract);
    }
}
