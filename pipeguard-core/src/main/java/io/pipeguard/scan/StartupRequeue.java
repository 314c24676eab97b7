package io.pipeguard.scan;

import io.pipeguard.Envelope;
import io.pipeguard.bus.EventPublisher;
import io.pipeguard.model.TrackedCollection;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.spi.ConnectionProvider;
import io.pipeguard.spi.EntityStore;
import io.pipeguard.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-shot pass run when a stage service starts: republishes the trigger event of every
 * pending entity so that work interrupted by a restart resumes without waiting for the
 * scanner.
 *
 * <p>Attempt counts are not touched. Failures are logged and counted but never thrown, so a
 * broken store or bus cannot keep the service from starting.
 */
public final class StartupRequeue {
    private static final Logger logger = Logger.getLogger(StartupRequeue.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EntityStore entityStore;
    private final EventPublisher publisher;
    private final MetricsExporter metrics;
    private final boolean enabled;
    private final int limit;

    private StartupRequeue(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.entityStore = Objects.requireNonNull(builder.entityStore, "entityStore");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        if (builder.limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.enabled = builder.enabled;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Requeues the pending entities of each collection.
     *
     * @return total number of envelopes republished
     */
    public int run(List<TrackedCollection> collections) {
        if (!enabled) {
            logger.log(Level.INFO, "Startup requeue disabled");
            return 0;
        }
        int total = 0;
        for (TrackedCollection collection : collections) {
            total += requeue(collection,
                    (conn, max) -> entityStore.findIncomplete(conn, collection.name(), max));
        }
        return total;
    }

    /**
     * Requeues the entities selected by {@code query} for one collection.
     *
     * @return number of envelopes republished
     */
    public int requeue(TrackedCollection collection, IncompleteWorkQuery query) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(query, "query");
        if (!enabled) {
            return 0;
        }
        List<TrackedEntity> incomplete;
        try (Connection conn = connectionProvider.getConnection()) {
            incomplete = query.find(conn, limit);
        } catch (SQLException | RuntimeException e) {
            metrics.incrementStartupRequeueError(collection.name());
            logger.log(Level.SEVERE, "Startup requeue could not query " + collection.name()
                    + "; continuing startup", e);
            return 0;
        }

        int requeued = 0;
        for (TrackedEntity entity : incomplete) {
            if (entity.triggerData() == null) {
                metrics.incrementStartupRequeueError(collection.name());
                logger.log(Level.WARNING, "No trigger data for " + collection.name() + "/" + entity.id());
                continue;
            }
            try {
                Envelope envelope = Envelope.builder(collection.triggerEvent()).data(entity.triggerData()).build();
                publisher.publish(collection.triggerEvent().routingKey(), envelope);
                requeued++;
                metrics.incrementStartupRequeued(collection.name());
            } catch (RuntimeException e) {
                metrics.incrementStartupRequeueError(collection.name());
                logger.log(Level.WARNING, "Startup requeue failed for " + collection.name() + "/" + entity.id(), e);
            }
        }
        if (requeued > 0) {
            logger.log(Level.INFO, "Startup requeue: " + requeued + " incomplete " + collection.name()
                    + " republished as " + collection.triggerEvent().typeName());
        }
        return requeued;
    }

    /** Builder for {@link StartupRequeue}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EntityStore entityStore;
        private EventPublisher publisher;
        private MetricsExporter metrics;
        private boolean enabled = true;
        private int limit = 1000;

        private Builder() {
        }

        /** <p><b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <p><b>Required.</b> */
        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        /** <p><b>Required.</b> */
        public Builder publisher(EventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /** <p>Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** <p>Optional. Defaults to {@code true}. */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Sets the maximum entities requeued per collection.
         *
         * <p>Optional. Defaults to {@code 1000}.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public StartupRequeue build() {
            return new StartupRequeue(this);
        }
    }
}
