package io.pipeguard.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.InMemoryEntityStore;
import io.pipeguard.RecordingPublisher;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedCollection;
import io.pipeguard.model.TrackedCollections;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.retry.ExponentialBackoffRetryPolicy;
import io.pipeguard.spi.ConnectionProvider;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.util.Jsons;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StuckDocumentScannerTest {
  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
  private static final TrackedCollection ARCHIVES = TrackedCollections.ARCHIVES;

  private final InMemoryEntityStore store = new InMemoryEntityStore();
  private final RecordingPublisher publisher = new RecordingPublisher();
  private final List<String> errors = new ArrayList<>();
  private final AtomicInteger failedRuns = new AtomicInteger();

  private final MetricsExporter metrics = new MetricsExporter() {
    @Override
    public void incrementScannerError(String errorType) {
      errors.add(errorType);
    }

    @Override
    public void incrementScannerRun(boolean success) {
      if (!success) {
        failedRuns.incrementAndGet();
      }
    }
  };

  private StuckDocumentScanner.Builder scanner() {
    return StuckDocumentScanner.builder()
        .connectionProvider(InMemoryEntityStore::dummyConnection)
        .entityStore(store)
        .publisher(publisher)
        .collections(List.of(ARCHIVES))
        .backoff(ExponentialBackoffRetryPolicy.scanner(Duration.ofMinutes(5), Duration.ofMinutes(60)))
        .stuckThreshold(Duration.ofHours(24))
        .metrics(metrics)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static ObjectNode archiveData(String id) {
    ObjectNode data = Jsons.object();
    data.put("archive_id", id);
    data.put("source_name", "list-archive");
    data.put("file_path", "/data/" + id + ".mbox");
    return data;
  }

  private static TrackedEntity pending(String id, int attempts, Instant lastAttempt, Instant createdAt) {
    return new TrackedEntity("archives", id, EntityStatus.PENDING, attempts, lastAttempt, archiveData(id), createdAt);
  }

  @Test
  void republishesStuckEntityAndCountsAttempt() {
    store.put(pending("a1", 0, null, NOW.minus(Duration.ofHours(25))));

    ScanReport report = scanner().build().scanOnce();

    List<Envelope> republished = publisher.publishedTo("archive.ingested");
    assertEquals(1, republished.size());
    assertEquals("ArchiveIngested", republished.get(0).type());
    assertEquals("a1", republished.get(0).text("archive_id"));
    TrackedEntity after = store.get("archives", "a1");
    assertEquals(1, after.attemptCount());
    assertEquals(NOW, after.lastAttemptTime());
    assertEquals(1, report.collection("archives").requeued());
    assertTrue(report.succeeded());
  }

  @Test
  void neverAttemptedEntityIsRepublishedBeforeThreshold() {
    store.put(pending("a1", 0, null, NOW.minus(Duration.ofHours(1))));

    ScanReport report = scanner().build().scanOnce();

    assertEquals(1, report.collection("archives").stuck());
    assertEquals(1, report.collection("archives").requeued());
    assertEquals(1, publisher.publishedTo("archive.ingested").size());
    assertEquals(1, store.get("archives", "a1").attemptCount());
  }

  @Test
  void recentlyAttemptedEntityWaitsForThreshold() {
    store.put(pending("a1", 1, NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofDays(3))));

    ScanReport report = scanner().build().scanOnce();

    assertEquals(0, report.collection("archives").stuck());
    assertTrue(publisher.published().isEmpty());
  }

  @Test
  void backoffNotElapsedIsSkipped() {
    store.put(pending("a1", 2, NOW.minus(Duration.ofMinutes(5)), NOW.minus(Duration.ofDays(3))));

    ScanReport report = scanner().stuckThreshold(Duration.ZERO).build().scanOnce();

    assertTrue(publisher.published().isEmpty());
    assertEquals(1, report.collection("archives").skippedBackoff());
    assertEquals(2, store.get("archives", "a1").attemptCount());
  }

  @Test
  void backoffElapsedIsPicked() {
    TrackedCollection relaxed = ARCHIVES.withMaxAttempts(5);
    store.put(pending("a1", 2, NOW.minus(Duration.ofMinutes(15)), NOW.minus(Duration.ofDays(3))));

    ScanReport report = scanner().collections(List.of(relaxed)).stuckThreshold(Duration.ZERO).build().scanOnce();

    assertEquals(1, publisher.published().size());
    assertEquals(1, report.collection("archives").requeued());
    assertEquals(3, store.get("archives", "a1").attemptCount());
  }

  @Test
  void eligibilityFollowsBackoffSchedule() {
    StuckDocumentScanner scanner = scanner().stuckThreshold(Duration.ZERO).build();

    assertFalse(scanner.isEligible(pending("a1", 2, NOW.minus(Duration.ofMinutes(5)), NOW.minus(Duration.ofDays(1))), NOW));
    assertTrue(scanner.isEligible(pending("a1", 2, NOW.minus(Duration.ofMinutes(15)), NOW.minus(Duration.ofDays(1))), NOW));
    assertTrue(scanner.isEligible(pending("a1", 1, NOW.minus(Duration.ofSeconds(1)), NOW.minus(Duration.ofDays(1))), NOW));
    assertTrue(scanner.isEligible(pending("a1", 0, null, NOW.minus(Duration.ofDays(1))), NOW));
    assertTrue(scanner().build().isEligible(pending("a1", 0, null, NOW), NOW));
    assertFalse(scanner().build().isEligible(pending("a1", 1, NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofDays(3))), NOW));
  }

  @Test
  void reachingCeilingMarksFailedWithoutRepublish() {
    store.put(pending("a1", 2, NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(3))));

    ScanReport report = scanner().build().scanOnce();

    assertTrue(publisher.published().isEmpty());
    TrackedEntity after = store.get("archives", "a1");
    assertEquals(EntityStatus.FAILED_MAX_RETRIES, after.status());
    assertEquals(3, after.attemptCount());
    assertEquals(1, report.collection("archives").markedFailed());
    assertEquals(1, report.collection("archives").failedTotal());
  }

  @Test
  void exhaustedPendingEntityIsSwept() {
    store.put(pending("a1", 4, NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(3))));

    ScanReport report = scanner().build().scanOnce();

    assertEquals(EntityStatus.FAILED_MAX_RETRIES, store.get("archives", "a1").status());
    assertEquals(1, report.collection("archives").markedFailed());
    assertTrue(publisher.published().isEmpty());
  }

  @Test
  void terminalEntitiesAreLeftAlone() {
    Instant old = NOW.minus(Duration.ofDays(3));
    store.put(new TrackedEntity("archives", "done", EntityStatus.PROCESSED, 1, old, archiveData("done"), old));
    store.put(new TrackedEntity("archives", "dead", EntityStatus.FAILED_MAX_RETRIES, 3, old, archiveData("dead"), old));

    scanner().build().scanOnce();

    assertTrue(publisher.published().isEmpty());
    assertEquals(EntityStatus.PROCESSED, store.get("archives", "done").status());
  }

  @Test
  void lostIncrementRaceSkipsEntity() {
    store.put(pending("a1", 0, null, NOW.minus(Duration.ofDays(2))));
    InMemoryEntityStore racing = new InMemoryEntityStore() {
      @Override
      public synchronized int recordAttempt(Connection conn, String collection, String id, int expected, Instant now) {
        return 0;
      }
    };
    racing.put(store.get("archives", "a1"));

    ScanReport report = scanner().entityStore(racing).build().scanOnce();

    assertEquals(1, report.collection("archives").lostRace());
    assertTrue(publisher.published().isEmpty());
  }

  @Test
  void publishErrorIsCountedAndScanContinues() {
    store.put(pending("a1", 0, null, NOW.minus(Duration.ofDays(2))));
    store.put(pending("a2", 0, null, NOW.minus(Duration.ofDays(2))));
    publisher.failWith(new IllegalStateException("bus down"));

    ScanReport report = scanner().build().scanOnce();

    assertEquals(2, report.collection("archives").publishErrors());
    assertEquals(List.of("publish_error", "publish_error"), errors);
  }

  @Test
  void collectionErrorDoesNotStopOtherCollections() {
    ConnectionProvider flaky = new ConnectionProvider() {
      private int calls;

      @Override
      public Connection getConnection() throws SQLException {
        if (calls++ == 0) {
          throw new SQLException("connection refused");
        }
        return InMemoryEntityStore.dummyConnection();
      }
    };
    store.put(new TrackedEntity("messages", "m1", EntityStatus.PENDING, 0, null, messageData(),
        NOW.minus(Duration.ofDays(2))));

    ScanReport report = scanner()
        .connectionProvider(flaky)
        .collections(List.of(ARCHIVES, TrackedCollections.MESSAGES))
        .build()
        .scanOnce();

    assertFalse(report.collection("archives").succeeded());
    assertTrue(report.collection("messages").succeeded());
    assertEquals(1, publisher.publishedTo("json.parsed").size());
    assertEquals(List.of("collection_error"), errors);
    assertEquals(1, failedRuns.get());
  }

  @Test
  void builderValidation() {
    assertThrows(IllegalArgumentException.class, () -> scanner().collections(List.of()).build());
    assertThrows(IllegalArgumentException.class, () -> scanner().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> scanner().interval(Duration.ZERO).build());
    assertThrows(NullPointerException.class, () -> scanner().publisher(null).build());
  }

  @Test
  void startAndCloseAreIdempotent() {
    StuckDocumentScanner scanner = scanner().interval(Duration.ofHours(1)).build();

    scanner.start();
    scanner.start();
    scanner.close();
    scanner.close();

    assertThrows(IllegalStateException.class, scanner::start);
  }

  private static ObjectNode messageData() {
    ObjectNode data = Jsons.object();
    data.put("archive_id", "a1");
    data.put("message_count", 3);
    return data;
  }
}
