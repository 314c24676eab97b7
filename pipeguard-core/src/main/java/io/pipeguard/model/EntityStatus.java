package io.pipeguard.model;

/**
 * Lifecycle state of a tracked entity. There is deliberately no in-progress state: an entity
 * is either still to be done, done, or abandoned by the stuck-document scanner.
 */
public enum EntityStatus {
    PENDING(0),
    PROCESSED(1),
    FAILED_MAX_RETRIES(2);

    private final int code;

    EntityStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * @throws IllegalArgumentException for an unknown code
     */
    public static EntityStatus fromCode(int code) {
        for (EntityStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + code);
    }
}
