package io.pipeguard.idempotency;

public enum WriteOutcome {
    APPLIED,
    ALREADY_APPLIED
}
