package io.pipeguard.bus;

import io.pipeguard.Envelope;
import io.pipeguard.EventHandler;
import io.pipeguard.HandlerResult;
import io.pipeguard.ack.Acknowledgement;
import io.pipeguard.ack.AcknowledgmentPolicy;
import io.pipeguard.ack.FailureClassifier;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.SchemaRegistry;
import io.pipeguard.schema.ValidationException;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker pool consuming one queue with mandatory schema validation.
 *
 * <p>For each delivery the subscriber decodes the envelope, validates it against the schema
 * registry, looks up the handler for its type and invokes it. Application code never sees a
 * malformed envelope: such deliveries are dropped before any handler runs. The handler's
 * {@link HandlerResult} (or the classification of an escaped exception) is turned into an
 * ack, requeue or drop by the {@link AcknowledgmentPolicy}.
 *
 * <p>{@link #close()} stops fetching, gives in-flight deliveries up to the drain timeout, then
 * interrupts workers. An interrupted handler's message is requeued and will be redelivered.
 *
 * @see ValidatingSubscriber.Builder
 */
public final class ValidatingSubscriber implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ValidatingSubscriber.class.getName());

    private final MessageBus bus;
    private final String queue;
    private final String consumerId;
    private final SchemaRegistry registry;
    private final EnvelopeCodec codec;
    private final HandlerRegistry handlers;
    private final FailureClassifier classifier;
    private final AcknowledgmentPolicy policy;
    private final MetricsExporter metrics;
    private final int workerCount;
    private final int batchSize;
    private final long pollIntervalMs;
    private final long drainTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService workers;
    private volatile boolean closed;

    private ValidatingSubscriber(Builder builder) {
        this.bus = Objects.requireNonNull(builder.bus, "bus");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.handlers = Objects.requireNonNull(builder.handlers, "handlers");
        this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
        this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
        this.policy = builder.policy != null ? builder.policy : AcknowledgmentPolicy.STANDARD;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.consumerId = builder.consumerId != null ? builder.consumerId : queue + "-consumer";

        if (builder.workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (builder.batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (builder.pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        this.workerCount = builder.workerCount;
        this.batchSize = builder.batchSize;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the worker threads. Subsequent calls are no-ops while running.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ValidatingSubscriber has been closed");
        }
        if (workers != null) {
            return;
        }
        running.set(true);
        workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("pipeguard-" + queue + "-"));
        for (int i = 0; i < workerCount; i++) {
            // Each worker claims under its own id so the JDBC bus can tell claims apart
            String workerId = consumerId + "-" + (i + 1);
            workers.submit(() -> workerLoop(workerId));
        }
    }

    /**
     * Fetches and processes a single batch on the calling thread.
     *
     * @return number of deliveries processed
     */
    public int processOnce() {
        List<Delivery> batch = bus.fetch(queue, consumerId, batchSize);
        for (Delivery delivery : batch) {
            process(delivery);
        }
        return batch.size();
    }

    private void workerLoop(String workerId) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                List<Delivery> batch = bus.fetch(queue, workerId, batchSize);
                if (batch.isEmpty()) {
                    Thread.sleep(pollIntervalMs);
                    continue;
                }
                for (int i = 0; i < batch.size(); i++) {
                    if (!running.get()) {
                        releaseUnprocessed(batch.subList(i, batch.size()));
                        break;
                    }
                    process(batch.get(i));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Subscriber loop error on queue " + queue, t);
            }
        }
    }

    private void releaseUnprocessed(List<Delivery> deliveries) {
        for (Delivery delivery : deliveries) {
            try {
                bus.nack(delivery, true);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to release messageId=" + delivery.messageId(), e);
            }
        }
    }

    /**
     * Runs one delivery through validation, handling and acknowledgment.
     *
     * @return the acknowledgment applied to the bus
     */
    public Acknowledgement process(Delivery delivery) {
        HandlerResult result = handle(delivery);
        Acknowledgement decision = policy.decide(result);
        try {
            switch (decision) {
                case ACK -> bus.ack(delivery);
                case REQUEUE -> bus.nack(delivery, true);
                case DROP -> bus.nack(delivery, false);
            }
        } catch (RuntimeException e) {
            // Unacknowledged messages are redelivered, so this only delays the decision
            logger.log(Level.SEVERE, "Failed to apply " + decision + " to messageId=" + delivery.messageId(), e);
        }
        metrics.incrementDelivery(queue, decision);
        if (result instanceof HandlerResult.Failed failed) {
            logger.log(decision == Acknowledgement.REQUEUE ? Level.INFO : Level.WARNING,
                    "queue=" + queue + " message_id=" + delivery.messageId() + " outcome=" + decision
                            + " failure=" + failed.kind() + " error_type=" + failed.errorType()
                            + " delivery_count=" + delivery.deliveryCount());
        }
        return decision;
    }

    private HandlerResult handle(Delivery delivery) {
        Envelope envelope;
        try {
            envelope = codec.decode(delivery.body());
            registry.validate(envelope);
        } catch (ValidationException e) {
            metrics.incrementValidationFailure(e.eventType() == null ? "unknown" : e.eventType(), "consume");
            return HandlerResult.malformed(e);
        }

        EventHandler handler = handlers.handlerFor(envelope.type());
        if (handler == null) {
            return HandlerResult.permanent(
                    new UnroutableEventException("No handler for type=" + envelope.type() + " on queue " + queue));
        }
        try {
            HandlerResult result = handler.onEvent(envelope);
            if (result == null) {
                return HandlerResult.permanent(
                        new IllegalStateException("Handler for " + envelope.type() + " returned no result"));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HandlerResult.transientFailure(e);
        } catch (Exception e) {
            return HandlerResult.failed(classifier.classify(e), e);
        }
    }

    /**
     * Stops fetching and waits up to the drain timeout for in-flight deliveries before
     * interrupting the workers.
     */
    @Override
    public synchronized void close() {
        closed = true;
        running.set(false);
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded on queue " + queue
                        + "; interrupting in-flight deliveries, they will be redelivered");
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link ValidatingSubscriber}. */
    public static final class Builder {
        private MessageBus bus;
        private String queue;
        private String consumerId;
        private SchemaRegistry registry;
        private EnvelopeCodec codec;
        private HandlerRegistry handlers;
        private FailureClassifier classifier;
        private AcknowledgmentPolicy policy;
        private MetricsExporter metrics;
        private int workerCount = 1;
        private int batchSize = 10;
        private long pollIntervalMs = 200;
        private long drainTimeoutMs = 30_000;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder bus(MessageBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Sets the queue to consume.
         *
         * <p><b>Required.</b>
         */
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the claim owner prefix; each worker appends its index.
         *
         * <p>Optional. Defaults to {@code <queue>-consumer}.
         */
        public Builder consumerId(String consumerId) {
            this.consumerId = consumerId;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder schemaRegistry(SchemaRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * <p>Optional. Defaults to a codec over the shared mapper.
         */
        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        /**
         * Sets how exceptions escaping a handler are classified.
         *
         * <p><b>Required.</b> There is no built-in default classification.
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link AcknowledgmentPolicy#STANDARD}.
         */
        public Builder acknowledgmentPolicy(AcknowledgmentPolicy policy) {
            this.policy = policy;
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
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets how many messages one worker claims per fetch.
         *
         * <p>Optional. Defaults to {@code 10}.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the idle wait after an empty fetch.
         *
         * <p>Optional. Defaults to {@code 200} ms.
         */
        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /**
         * Sets how long {@link #close()} waits for in-flight deliveries, including an in-flight
         * retry loop, before interrupting them.
         *
         * <p>Optional. Defaults to {@code 30000} ms.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public ValidatingSubscriber build() {
            return new ValidatingSubscriber(this);
        }
    }
}
