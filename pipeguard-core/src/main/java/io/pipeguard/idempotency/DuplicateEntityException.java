package io.pipeguard.idempotency;

/**
 * Raised by a store when an insert collides with an existing id.
 */
public class DuplicateEntityException extends RuntimeException {
    private final String collection;
    private final String entityId;

    public DuplicateEntityException(String collection, String entityId, Throwable cause) {
        super("Entity already exists: " + collection + "/" + entityId, cause);
        this.collection = collection;
        this.entityId = entityId;
    }

    public String collection() {
        return collection;
    }

    public String entityId() {
        return entityId;
    }
}
