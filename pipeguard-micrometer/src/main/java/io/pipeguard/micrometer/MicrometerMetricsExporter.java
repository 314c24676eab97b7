package io.pipeguard.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.pipeguard.ack.Acknowledgement;
import io.pipeguard.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are tagged by stage, collection or queue and registered lazily on first use.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pipeguard.retry.attempts}, {@code .retry.success}, {@code .retry.exhausted} (tag {@code stage})</li>
 *   <li>{@code pipeguard.failure.permanent}, {@code .failed.event.publish.errors} (tag {@code stage})</li>
 *   <li>{@code pipeguard.deliveries} (tags {@code queue}, {@code outcome})</li>
 *   <li>{@code pipeguard.validation.failures} (tags {@code event_type}, {@code direction})</li>
 *   <li>{@code pipeguard.duplicates.suppressed} (tag {@code collection})</li>
 *   <li>{@code pipeguard.scanner.requeued}, {@code .scanner.skipped.backoff},
 *       {@code .scanner.max.retries.exceeded} (tag {@code collection})</li>
 *   <li>{@code pipeguard.scanner.errors} (tag {@code error_type}), {@code .scanner.runs} (tag {@code status})</li>
 *   <li>{@code pipeguard.startup.requeued}, {@code .startup.requeue.errors} (tag {@code collection})</li>
 *   <li>{@code pipeguard.failed.queue.actions} (tags {@code queue}, {@code action})</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code pipeguard.scanner.stuck.documents}, {@code .scanner.failed.documents} (tag {@code collection})</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code pipeguard.scanner.duration.ms}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String prefix;
  private final DistributionSummary scanDuration;
  private final Set<Meter> meters = ConcurrentHashMap.newKeySet();
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "pipeguard"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "pipeguard");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-pipeline use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "archive.pipeline"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.prefix = namePrefix;
    this.scanDuration = DistributionSummary.builder(namePrefix + ".scanner.duration.ms")
        .description("Duration of one stuck-document scan in milliseconds")
        .register(registry);
    meters.add(scanDuration);
  }

  @Override
  public void incrementRetryAttempt(String stage) {
    count("retry.attempts", "In-process retries scheduled", 1, "stage", stage);
  }

  @Override
  public void incrementRetrySuccess(String stage) {
    count("retry.success", "Units of work that succeeded after retrying", 1, "stage", stage);
  }

  @Override
  public void incrementRetryExhausted(String stage) {
    count("retry.exhausted", "Transient failures that ran out of in-process retries", 1, "stage", stage);
  }

  @Override
  public void incrementPermanentFailure(String stage) {
    count("failure.permanent", "Permanent or malformed-input failures", 1, "stage", stage);
  }

  @Override
  public void incrementFailedEventPublishError(String stage) {
    count("failed.event.publish.errors", "Failure events that could not be published", 1, "stage", stage);
  }

  @Override
  public void incrementDelivery(String queue, Acknowledgement outcome) {
    count("deliveries", "Deliveries settled by outcome", 1,
        "queue", queue, "outcome", outcome.name().toLowerCase());
  }

  @Override
  public void incrementValidationFailure(String eventType, String direction) {
    count("validation.failures", "Envelopes rejected by schema validation", 1,
        "event_type", eventType == null ? "unknown" : eventType, "direction", direction);
  }

  @Override
  public void incrementDuplicateSuppressed(String collection) {
    count("duplicates.suppressed", "Idempotent writes whose effect already existed", 1, "collection", collection);
  }

  @Override
  public void incrementScannerRequeued(String collection) {
    count("scanner.requeued", "Stuck entities republished by the scanner", 1, "collection", collection);
  }

  @Override
  public void incrementScannerSkippedBackoff(String collection) {
    count("scanner.skipped.backoff", "Stuck entities skipped inside their backoff window", 1,
        "collection", collection);
  }

  @Override
  public void incrementScannerMaxRetriesExceeded(String collection) {
    count("scanner.max.retries.exceeded", "Entities moved to failed_max_retries", 1, "collection", collection);
  }

  @Override
  public void incrementScannerError(String errorType) {
    count("scanner.errors", "Scanner errors by type", 1, "error_type", errorType);
  }

  @Override
  public void incrementScannerRun(boolean success) {
    count("scanner.runs", "Completed scanner passes", 1, "status", success ? "success" : "failure");
  }

  @Override
  public void recordStuckDocuments(String collection, int count) {
    gauge("scanner.stuck.documents", "Stuck entities seen by the last scan", collection).set(count);
  }

  @Override
  public void recordFailedDocuments(String collection, long count) {
    gauge("scanner.failed.documents", "Entities in failed_max_retries", collection).set(count);
  }

  @Override
  public void recordScanDurationMs(long durationMs) {
    if (closed) return;
    scanDuration.record(durationMs);
  }

  @Override
  public void incrementStartupRequeued(String collection) {
    count("startup.requeued", "Incomplete entities republished at startup", 1, "collection", collection);
  }

  @Override
  public void incrementStartupRequeueError(String collection) {
    count("startup.requeue.errors", "Startup requeue failures", 1, "collection", collection);
  }

  @Override
  public void incrementFailedQueueAction(String queue, String action, int count) {
    count("failed.queue.actions", "Messages touched by failed-queue operations", count,
        "queue", queue, "action", action);
  }

  private void count(String name, String description, double amount, String... tags) {
    if (closed) return;
    Counter counter = Counter.builder(prefix + "." + name)
        .description(description)
        .tags(tags)
        .register(registry);
    meters.add(counter);
    counter.increment(amount);
  }

  private AtomicLong gauge(String name, String description, String collection) {
    if (closed) {
      return new AtomicLong();
    }
    return gaugeValues.computeIfAbsent(name + "|" + collection, key -> {
      AtomicLong value = new AtomicLong();
      meters.add(Gauge.builder(prefix + "." + name, value, AtomicLong::get)
          .description(description)
          .tag("collection", collection)
          .register(registry));
      return value;
    });
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    meters.clear();
    gaugeValues.clear();
    if (first != null) throw first;
  }
}
