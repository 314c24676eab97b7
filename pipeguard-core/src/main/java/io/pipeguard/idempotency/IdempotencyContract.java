package io.pipeguard.idempotency;

/**
 * How the write representing "unit X was processed" tolerates repeated delivery.
 */
public enum IdempotencyContract {
    /** Insert keyed by a content-derived id; a duplicate-key conflict means already done. */
    UNIQUE_INSERT,
    /** Look up an existing terminal result first and skip the side effect if present. */
    CHECK_BEFORE_WRITE,
    /** Write keyed by the same deterministic id every time; repeating it changes nothing. */
    UPSERT_BY_ID
}
