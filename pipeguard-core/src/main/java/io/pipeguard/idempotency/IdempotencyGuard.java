package io.pipeguard.idempotency;

import io.pipeguard.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Makes the write that records "unit X was processed" safe under at-least-once delivery,
 * following the {@link IdempotencyContract} declared for the entity type.
 *
 * <p>Redelivery is expected, so finding the effect already applied is reported as
 * {@link WriteOutcome#ALREADY_APPLIED} rather than as an error.
 */
public final class IdempotencyGuard {
    private static final Logger logger = Logger.getLogger(IdempotencyGuard.class.getName());

    /** A write or side effect that may throw. */
    @FunctionalInterface
    public interface Write {
        void run() throws Exception;
    }

    /** A lookup for an existing terminal result. */
    @FunctionalInterface
    public interface Lookup {
        boolean exists() throws Exception;
    }

    private final String collection;
    private final IdempotencyContract contract;
    private final MetricsExporter metrics;

    public IdempotencyGuard(String collection, IdempotencyContract contract) {
        this(collection, contract, MetricsExporter.NOOP);
    }

    public IdempotencyGuard(String collection, IdempotencyContract contract, MetricsExporter metrics) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.contract = Objects.requireNonNull(contract, "contract");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    public IdempotencyContract contract() {
        return contract;
    }

    /**
     * Runs a unique-key insert. A {@link DuplicateEntityException} means an earlier delivery
     * already inserted the row.
     */
    public WriteOutcome insertUnique(String entityId, Write insert) throws Exception {
        requireContract(IdempotencyContract.UNIQUE_INSERT);
        try {
            insert.run();
            return WriteOutcome.APPLIED;
        } catch (DuplicateEntityException e) {
            return alreadyApplied(entityId);
        }
    }

    /**
     * Skips {@code action} when {@code lookup} finds an existing terminal result for the id.
     */
    public WriteOutcome checkBeforeWrite(String entityId, Lookup lookup, Write action) throws Exception {
        requireContract(IdempotencyContract.CHECK_BEFORE_WRITE);
        if (lookup.exists()) {
            return alreadyApplied(entityId);
        }
        action.run();
        return WriteOutcome.APPLIED;
    }

    /**
     * Runs a write keyed by the deterministic id; repeating it is harmless by construction.
     */
    public WriteOutcome upsert(String entityId, Write write) throws Exception {
        requireContract(IdempotencyContract.UPSERT_BY_ID);
        Objects.requireNonNull(entityId, "entityId");
        write.run();
        return WriteOutcome.APPLIED;
    }

    private WriteOutcome alreadyApplied(String entityId) {
        metrics.incrementDuplicateSuppressed(collection);
        logger.log(Level.FINE, "collection=" + collection + " entity_id=" + entityId + " outcome=already_applied");
        return WriteOutcome.ALREADY_APPLIED;
    }

    private void requireContract(IdempotencyContract expected) {
        if (contract != expected) {
            throw new IllegalStateException("Collection " + collection + " declares " + contract
                    + ", not " + expected);
        }
    }
}
