package io.pipeguard.retry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.FailureKind;
import io.pipeguard.HandlerResult;
import io.pipeguard.ack.FailureClassifier;
import io.pipeguard.bus.EventPublisher;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.stage.StageDescriptor;
import io.pipeguard.util.Jsons;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-process retry loop around one unit of work inside a single handler invocation.
 *
 * <p>Per call: {@code Attempt(n)} either succeeds, fails transiently and is retried after
 * {@link RetryPolicy#computeDelayMs(int) backoff(n)}, or fails permanently and aborts. When
 * transient failures use up {@code maxAttempts}, or on the first permanent or malformed
 * failure, exactly one {@code <Stage>Failed} event is published with the original data and
 * one structured log line is written. The returned result keeps the failure kind, so a
 * subscriber requeues exhausted transient work for bus-level redelivery and drops the rest.
 * If the failure event itself cannot be published the result is transient, so the message
 * is redelivered rather than dropped with no durable trace.
 *
 * <p>This is the only place that decides between retrying and giving up; callers above it
 * should not add retry logic of their own.
 *
 * @see RetryExecutor.Builder
 */
public final class RetryExecutor {
    private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

    private final StageDescriptor stage;
    private final int maxAttempts;
    private final RetryPolicy retryPolicy;
    private final FailureClassifier classifier;
    private final EventPublisher failurePublisher;
    private final MetricsExporter metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration maxElapsed;

    private RetryExecutor(Builder builder) {
        this.stage = Objects.requireNonNull(builder.stage, "stage");
        this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
        this.failurePublisher = Objects.requireNonNull(builder.failurePublisher, "failurePublisher");
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = builder.maxAttempts;
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(5_000, 60_000);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.maxElapsed != null && (builder.maxElapsed.isZero() || builder.maxElapsed.isNegative())) {
            throw new IllegalArgumentException("maxElapsed must be positive");
        }
        this.maxElapsed = builder.maxElapsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StageDescriptor stage() {
        return stage;
    }

    /**
     * Runs the unit of work with retries.
     *
     * @param trigger  envelope being handled; its data becomes {@code original_data} of a failure event
     * @param entityId content-derived id of the unit of work
     * @param work     the work to attempt
     * @return {@code Done}, or the final classified failure
     */
    public HandlerResult execute(Envelope trigger, String entityId, UnitOfWork work) {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(work, "work");

        Instant startedAt = clock.instant();
        int attempt = 0;
        while (true) {
            attempt++;
            HandlerResult result = attempt(work);
            if (result instanceof HandlerResult.Done) {
                if (attempt > 1) {
                    metrics.incrementRetrySuccess(stage.name());
                    logger.log(Level.INFO, "stage=" + stage.name() + " entity_id=" + entityId
                            + " outcome=succeeded_after_retry attempts=" + attempt);
                }
                return result;
            }
            HandlerResult.Failed failure = (HandlerResult.Failed) result;

            if (failure.kind() != FailureKind.TRANSIENT) {
                metrics.incrementPermanentFailure(stage.name());
                return giveUp(trigger, entityId, failure, attempt, "permanent_failure");
            }
            if (attempt >= maxAttempts) {
                metrics.incrementRetryExhausted(stage.name());
                return giveUp(trigger, entityId, failure, attempt, "retry_exhausted");
            }

            long delayMs = retryPolicy.computeDelayMs(attempt);
            if (maxElapsed != null
                    && Duration.between(startedAt, clock.instant()).plusMillis(delayMs).compareTo(maxElapsed) > 0) {
                metrics.incrementRetryExhausted(stage.name());
                return giveUp(trigger, entityId, failure, attempt, "ttl_expired");
            }
            metrics.incrementRetryAttempt(stage.name());
            logger.log(Level.FINE, "stage=" + stage.name() + " entity_id=" + entityId + " attempt=" + attempt
                    + " error_type=" + failure.errorType() + " retry_in_ms=" + delayMs);
            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                // Shutdown mid-backoff: leave the message to bus redelivery, no failure event
                logger.log(Level.INFO, "stage=" + stage.name() + " entity_id=" + entityId
                        + " outcome=interrupted attempt=" + attempt);
                return HandlerResult.transientFailure(e);
            }
        }
    }

    private HandlerResult attempt(UnitOfWork work) {
        try {
            HandlerResult result = work.perform();
            return result != null ? result : HandlerResult.done();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HandlerResult.transientFailure(e);
        } catch (Exception e) {
            return HandlerResult.failed(classifier.classify(e), e);
        }
    }

    /**
     * Publishes the failure event and returns the result to hand to the acknowledgment policy:
     * the failure itself, or a transient failure when the event could not be published, so the
     * message is redelivered instead of dropped without a durable record.
     */
    private HandlerResult giveUp(Envelope trigger, String entityId, HandlerResult.Failed failure, int attempts,
                                 String outcome) {
        logger.log(Level.SEVERE, "stage=" + stage.name() + " outcome=" + outcome
                + " " + stage.idField() + "=" + entityId
                + " error_type=" + failure.errorType()
                + " retry_count=" + attempts
                + " failure=" + failure.kind()
                + " message=" + failure.errorMessage(), failure.cause());
        Envelope failed = Envelope.builder(stage.failedEvent())
                .data(failureData(trigger, entityId, failure, attempts))
                .build();
        try {
            failurePublisher.publish(stage.failedEvent().routingKey(), failed);
            return failure;
        } catch (RuntimeException e) {
            metrics.incrementFailedEventPublishError(stage.name());
            logger.log(Level.SEVERE, "Failed to publish " + stage.failedEvent().typeName() + " for "
                    + stage.idField() + "=" + entityId + "; leaving the message for redelivery", e);
            return HandlerResult.transientFailure(e);
        }
    }

    private ObjectNode failureData(Envelope trigger, String entityId, HandlerResult.Failed failure, int attempts) {
        ObjectNode data = Jsons.object();
        data.put(stage.idField(), entityId);
        data.set("original_data", trigger.data());
        data.put("error_message", failure.errorMessage());
        data.put("error_type", failure.errorType());
        data.put("retry_count", attempts);
        data.put("failed_at", DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.MILLIS)));
        return data;
    }

    /** Builder for {@link RetryExecutor}. */
    public static final class Builder {
        private StageDescriptor stage;
        private int maxAttempts = 3;
        private RetryPolicy retryPolicy;
        private FailureClassifier classifier;
        private EventPublisher failurePublisher;
        private MetricsExporter metrics;
        private Sleeper sleeper;
        private Clock clock;
        private Duration maxElapsed;

        private Builder() {
        }

        /**
         * Sets the stage whose failure event this executor emits.
         *
         * <p><b>Required.</b>
         */
        public Builder stage(StageDescriptor stage) {
            this.stage = stage;
            return this;
        }

        /**
         * Sets the number of attempts, including the first, before giving up on a transient failure.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 5s base and a 60s cap.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets how thrown exceptions are classified.
         *
         * <p><b>Required.</b>
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * Sets the publisher for {@code *Failed} events, normally a {@link io.pipeguard.bus.ValidatingPublisher}.
         *
         * <p><b>Required.</b>
         */
        public Builder failurePublisher(EventPublisher failurePublisher) {
            this.failurePublisher = failurePublisher;
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
         * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Bounds the wall time one {@code execute} call may spend retrying. A retry whose backoff
         * would end past the bound is not attempted; the work is given up as exhausted.
         *
         * <p>Optional. Defaults to {@code null}, no bound.
         */
        public Builder maxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
            return this;
        }

        /**
         * Sets the clock used for {@code failed_at} and the {@link #maxElapsed} bound.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
