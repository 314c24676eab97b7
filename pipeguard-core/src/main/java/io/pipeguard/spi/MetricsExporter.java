package io.pipeguard.spi;

import io.pipeguard.ack.Acknowledgement;

/**
 * Observability hook for retry, delivery and scanner counters.
 *
 * <p>All methods default to no-ops; {@link #NOOP} discards everything. See the
 * {@code pipeguard-micrometer} module for a Micrometer bridge.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /** An in-process retry is about to sleep and try again. */
    default void incrementRetryAttempt(String stage) {
    }

    /** A unit of work succeeded after at least one in-process retry. */
    default void incrementRetrySuccess(String stage) {
    }

    /** In-process retries ran out on a transient failure. */
    default void incrementRetryExhausted(String stage) {
    }

    /** A unit of work failed permanently or on malformed input. */
    default void incrementPermanentFailure(String stage) {
    }

    /** The {@code *Failed} event itself could not be published. */
    default void incrementFailedEventPublishError(String stage) {
    }

    default void incrementDelivery(String queue, Acknowledgement outcome) {
    }

    default void incrementValidationFailure(String eventType, String direction) {
    }

    /** An idempotent write found its effect already applied. */
    default void incrementDuplicateSuppressed(String collection) {
    }

    default void incrementScannerRequeued(String collection) {
    }

    default void incrementScannerSkippedBackoff(String collection) {
    }

    default void incrementScannerMaxRetriesExceeded(String collection) {
    }

    default void incrementScannerError(String errorType) {
    }

    default void incrementScannerRun(boolean success) {
    }

    default void recordStuckDocuments(String collection, int count) {
    }

    default void recordFailedDocuments(String collection, long count) {
    }

    default void recordScanDurationMs(long durationMs) {
    }

    default void incrementStartupRequeued(String collection) {
    }

    default void incrementStartupRequeueError(String collection) {
    }

    /** An operator action on a failed queue touched {@code count} messages. */
    default void incrementFailedQueueAction(String queue, String action, int count) {
    }

    /** Default no-op implementation. */
    final class Noop implements MetricsExporter {
    }
}
