package io.pipeguard.spi;

import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedEntity;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for tracked entities.
 *
 * <p>Every state change is a single conditional update so that concurrent stages and scanner
 * instances never need a lock: the {@code int} return values are affected row counts, and
 * zero means the precondition no longer held. All methods use the caller's connection and do
 * not commit.
 */
public interface EntityStore {

    /**
     * Inserts a new pending entity.
     *
     * @throws io.pipeguard.idempotency.DuplicateEntityException if the id already exists
     */
    void insertNew(Connection conn, TrackedEntity entity);

    /**
     * Inserts the entity if absent, otherwise refreshes its trigger data. Status and attempt
     * tracking of an existing row are left untouched.
     */
    void upsert(Connection conn, TrackedEntity entity);

    Optional<TrackedEntity> find(Connection conn, String collection, String id);

    /**
     * Moves a pending entity to {@link EntityStatus#PROCESSED}.
     *
     * @return 1 on transition, 0 if it was not pending (already processed or failed)
     */
    int markProcessed(Connection conn, String collection, String id);

    /**
     * Atomically increments the attempt count and stamps the attempt time, provided the entity
     * is still pending and its attempt count still equals {@code expectedAttemptCount}.
     *
     * @return 1 if this caller won the increment, 0 otherwise
     */
    int recordAttempt(Connection conn, String collection, String id, int expectedAttemptCount, Instant now);

    /**
     * Moves a pending entity to {@link EntityStatus#FAILED_MAX_RETRIES}.
     *
     * @return 1 on transition, 0 if it was not pending
     */
    int markFailedMaxRetries(Connection conn, String collection, String id);

    /**
     * Pending entities below the attempt ceiling that were never attempted or whose last attempt
     * is older than {@code stuckBefore}, ordered by last activity (last attempt, else creation).
     */
    List<TrackedEntity> findStuck(Connection conn, String collection, int maxAttempts, Instant stuckBefore, int limit);

    /**
     * Pending entities whose attempt count is already at or above the ceiling.
     */
    List<TrackedEntity> findExhausted(Connection conn, String collection, int maxAttempts, int limit);

    /**
     * Pending entities regardless of age or attempts, oldest first.
     */
    List<TrackedEntity> findIncomplete(Connection conn, String collection, int limit);

    long countByStatus(Connection conn, String collection, EntityStatus status);
}
