package io.pipeguard.scan;

import io.pipeguard.Envelope;
import io.pipeguard.bus.EventPublisher;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedCollection;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.retry.ExponentialBackoffRetryPolicy;
import io.pipeguard.retry.RetryPolicy;
import io.pipeguard.spi.ConnectionProvider;
import io.pipeguard.spi.EntityStore;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic job that finds tracked entities that never reached a terminal state and
 * re-injects their triggering event into the bus.
 *
 * <p>Per collection and pass:
 * <ol>
 *   <li>Pending entities already at or above the attempt ceiling are marked
 *       {@code FAILED_MAX_RETRIES}.</li>
 *   <li>Pending entities below the ceiling whose last activity is older than the stuck
 *       threshold are candidates.</li>
 *   <li>A candidate still inside {@code lastAttemptTime + backoff(attemptCount)} is skipped.</li>
 *   <li>The attempt count is incremented with a compare-and-set update; losing that race to
 *       another scanner instance skips the candidate.</li>
 *   <li>If the new count reached the ceiling the entity is marked {@code FAILED_MAX_RETRIES};
 *       otherwise its trigger event is republished.</li>
 * </ol>
 *
 * <p>This scanner is the only component that moves an entity to the terminal failure state.
 * An error in one collection is logged and counted and does not stop the others.
 *
 * @see StuckDocumentScanner.Builder
 */
public final class StuckDocumentScanner implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StuckDocumentScanner.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EntityStore entityStore;
    private final EventPublisher publisher;
    private final List<TrackedCollection> collections;
    private final RetryPolicy backoff;
    private final Duration stuckThreshold;
    private final Duration interval;
    private final int batchSize;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> scanTask;
    private volatile boolean closed;

    private StuckDocumentScanner(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.entityStore = Objects.requireNonNull(builder.entityStore, "entityStore");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        if (builder.collections == null || builder.collections.isEmpty()) {
            throw new IllegalArgumentException("at least one collection is required");
        }
        if (builder.stuckThreshold == null || builder.stuckThreshold.isNegative()) {
            throw new IllegalArgumentException("stuckThreshold must be >= 0");
        }
        if (builder.interval == null || builder.interval.isZero() || builder.interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.collections = List.copyOf(builder.collections);
        this.stuckThreshold = builder.stuckThreshold;
        this.interval = builder.interval;
        this.batchSize = builder.batchSize;
        this.backoff = builder.backoff != null ? builder.backoff
                : ExponentialBackoffRetryPolicy.scanner(Duration.ofMinutes(5), Duration.ofMinutes(60));
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules {@link #scanOnce()} at the configured interval, first run after one interval.
     * Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("StuckDocumentScanner has been closed");
        }
        if (scanTask != null) {
            return;
        }
        long intervalMs = interval.toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("pipeguard-scanner-"));
        scanTask = scheduler.scheduleWithFixedDelay(this::scheduledScan, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Stuck-document scanner started (interval " + interval + ", stuck threshold "
                + stuckThreshold + ")");
    }

    private void scheduledScan() {
        try {
            scanOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Stuck-document scan failed", t);
        }
    }

    /**
     * Runs one pass over every configured collection.
     */
    public ScanReport scanOnce() {
        long started = System.nanoTime();
        Instant now = clock.instant();
        List<ScanReport.CollectionReport> reports = new ArrayList<>();
        for (TrackedCollection collection : collections) {
            if (closed) {
                break;
            }
            reports.add(scanCollection(collection, now));
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        ScanReport report = new ScanReport(reports, duration);
        metrics.recordScanDurationMs(duration.toMillis());
        metrics.incrementScannerRun(report.succeeded());
        logger.log(Level.INFO, "Scan completed in " + duration.toMillis() + " ms: "
                + report.totalRequeued() + " requeued, " + report.totalMarkedFailed() + " marked failed");
        return report;
    }

    private ScanReport.CollectionReport scanCollection(TrackedCollection collection, Instant now) {
        String name = collection.name();
        int max = collection.maxAttempts();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);

            int markedFailed = 0;
            for (TrackedEntity entity : entityStore.findExhausted(conn, name, max, batchSize)) {
                if (entityStore.markFailedMaxRetries(conn, name, entity.id()) > 0) {
                    markedFailed++;
                    reportMaxRetries(collection, entity.id(), entity.attemptCount());
                }
            }

            List<TrackedEntity> stuck = entityStore.findStuck(conn, name, max, now.minus(stuckThreshold), batchSize);
            metrics.recordStuckDocuments(name, stuck.size());

            int requeued = 0;
            int skipped = 0;
            int lostRace = 0;
            int publishErrors = 0;
            for (TrackedEntity entity : stuck) {
                if (!isBackoffElapsed(entity, now)) {
                    skipped++;
                    metrics.incrementScannerSkippedBackoff(name);
                    logger.log(Level.FINE, "Skipping " + name + "/" + entity.id() + ": backoff not elapsed (attempt "
                            + entity.attemptCount() + ")");
                    continue;
                }
                if (entityStore.recordAttempt(conn, name, entity.id(), entity.attemptCount(), now) == 0) {
                    lostRace++;
                    continue;
                }
                int attempts = entity.attemptCount() + 1;
                if (attempts >= max) {
                    if (entityStore.markFailedMaxRetries(conn, name, entity.id()) > 0) {
                        markedFailed++;
                        reportMaxRetries(collection, entity.id(), attempts);
                    }
                    continue;
                }
                try {
                    republish(collection, entity);
                    requeued++;
                    metrics.incrementScannerRequeued(name);
                } catch (RuntimeException e) {
                    publishErrors++;
                    metrics.incrementScannerError("publish_error");
                    logger.log(Level.SEVERE, "Failed to republish " + collection.triggerEvent().typeName()
                            + " for " + name + "/" + entity.id(), e);
                }
            }

            long failedTotal = entityStore.countByStatus(conn, name, EntityStatus.FAILED_MAX_RETRIES);
            metrics.recordFailedDocuments(name, failedTotal);
            logger.log(Level.INFO, "Processed " + name + ": " + stuck.size() + " stuck, " + requeued + " requeued, "
                    + skipped + " skipped (backoff), " + markedFailed + " marked failed, " + failedTotal
                    + " failed in total");
            return new ScanReport.CollectionReport(name, stuck.size(), requeued, skipped, lostRace, markedFailed,
                    publishErrors, failedTotal, null);
        } catch (SQLException | RuntimeException e) {
            metrics.incrementScannerError("collection_error");
            logger.log(Level.SEVERE, "Error scanning collection " + name, e);
            return ScanReport.CollectionReport.failed(name, e);
        }
    }

    private void republish(TrackedCollection collection, TrackedEntity entity) {
        if (entity.triggerData() == null) {
            throw new IllegalStateException("No trigger data stored for " + collection.name() + "/" + entity.id());
        }
        Envelope envelope = Envelope.builder(collection.triggerEvent())
                .data(entity.triggerData())
                .timestamp(clock.instant())
                .build();
        publisher.publish(collection.triggerEvent().routingKey(), envelope);
    }

    private void reportMaxRetries(TrackedCollection collection, String entityId, int attempts) {
        metrics.incrementScannerMaxRetriesExceeded(collection.name());
        logger.log(Level.SEVERE, "collection=" + collection.name() + " outcome=failed_max_retries entity_id="
                + entityId + " error_type=MaxRetriesExceeded retry_count=" + attempts);
    }

    /**
     * Whether the entity is stuck and past its backoff window at {@code now}. Does not
     * consider the attempt ceiling.
     */
    public boolean isEligible(TrackedEntity entity, Instant now) {
        if (entity.status() != EntityStatus.PENDING) {
            return false;
        }
        Instant lastAttempt = entity.lastAttemptTime();
        boolean stuck = lastAttempt == null || lastAttempt.isBefore(now.minus(stuckThreshold));
        return stuck && isBackoffElapsed(entity, now);
    }

    private boolean isBackoffElapsed(TrackedEntity entity, Instant now) {
        if (entity.lastAttemptTime() == null) {
            return true;
        }
        Instant nextEligible = entity.lastAttemptTime().plusMillis(backoff.computeDelayMs(entity.attemptCount()));
        return !now.isBefore(nextEligible);
    }

    /**
     * Cancels the schedule and stops the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link StuckDocumentScanner}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EntityStore entityStore;
        private EventPublisher publisher;
        private List<TrackedCollection> collections;
        private RetryPolicy backoff;
        private Duration stuckThreshold = Duration.ofHours(24);
        private Duration interval = Duration.ofMinutes(15);
        private int batchSize = 500;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        /**
         * Sets the publisher for republished trigger events, normally a validating one.
         *
         * <p><b>Required.</b>
         */
        public Builder publisher(EventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /**
         * Sets the collections to scan with their attempt ceilings.
         *
         * <p><b>Required.</b>
         */
        public Builder collections(List<TrackedCollection> collections) {
            this.collections = collections;
            return this;
        }

        /**
         * Sets the cross-invocation backoff.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy#scanner} with a 5 minute
         * base and a 60 minute cap.
         */
        public Builder backoff(RetryPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Sets how long an entity may sit without activity before it counts as stuck.
         *
         * <p>Optional. Defaults to 24 hours. Must be &ge; 0.
         */
        public Builder stuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
            return this;
        }

        /**
         * <p>Optional. Defaults to 15 minutes.
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * Sets the maximum candidates examined per collection and pass.
         *
         * <p>Optional. Defaults to {@code 500}.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public StuckDocumentScanner build() {
            return new StuckDocumentScanner(this);
        }
    }
}
