package io.pipeguard.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.InMemoryEntityStore;
import io.pipeguard.RecordingPublisher;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedCollections;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.util.Jsons;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StartupRequeueTest {
  private static final Instant CREATED = Instant.parse("2025-06-01T12:00:00Z");

  private final InMemoryEntityStore store = new InMemoryEntityStore();
  private final RecordingPublisher publisher = new RecordingPublisher();
  private final AtomicInteger errors = new AtomicInteger();

  private StartupRequeue.Builder requeue() {
    return StartupRequeue.builder()
        .connectionProvider(InMemoryEntityStore::dummyConnection)
        .entityStore(store)
        .publisher(publisher)
        .metrics(new MetricsExporter() {
          @Override
          public void incrementStartupRequeueError(String collection) {
            errors.incrementAndGet();
          }
        });
  }

  private static ObjectNode archiveData(String id) {
    ObjectNode data = Jsons.object();
    data.put("archive_id", id);
    data.put("source_name", "list-archive");
    data.put("file_path", "/data/" + id + ".mbox");
    return data;
  }

  @Test
  void republishesPendingEntitiesWithoutTouchingAttempts() {
    store.put(TrackedEntity.pending("archives", "a1", archiveData("a1"), CREATED));
    store.put(TrackedEntity.pending("archives", "a2", archiveData("a2"), CREATED));
    store.put(new TrackedEntity("archives", "a3", EntityStatus.PROCESSED, 0, null, archiveData("a3"), CREATED));

    int requeued = requeue().build().run(List.of(TrackedCollections.ARCHIVES));

    assertEquals(2, requeued);
    assertEquals(2, publisher.publishedTo("archive.ingested").size());
    assertEquals(0, store.get("archives", "a1").attemptCount());
  }

  @Test
  void disabledIsNoOp() {
    store.put(TrackedEntity.pending("archives", "a1", archiveData("a1"), CREATED));

    assertEquals(0, requeue().enabled(false).build().run(List.of(TrackedCollections.ARCHIVES)));
    assertTrue(publisher.published().isEmpty());
  }

  @Test
  void queryFailureIsSwallowed() {
    int requeued = assertDoesNotThrow(() -> requeue().build().requeue(TrackedCollections.ARCHIVES,
        (conn, limit) -> {
          throw new SQLException("store unavailable");
        }));

    assertEquals(0, requeued);
    assertEquals(1, errors.get());
  }

  @Test
  void publishFailuresAreSkipped() {
    store.put(TrackedEntity.pending("archives", "a1", archiveData("a1"), CREATED));
    publisher.failWith(new IllegalStateException("bus down"));

    int requeued = assertDoesNotThrow(() -> requeue().build().run(List.of(TrackedCollections.ARCHIVES)));

    assertEquals(0, requeued);
    assertEquals(1, errors.get());
  }

  @Test
  void limitCapsEachCollection() {
    for (int i = 0; i < 5; i++) {
      store.put(TrackedEntity.pending("archives", "a" + i, archiveData("a" + i), CREATED.plusSeconds(i)));
    }

    assertEquals(2, requeue().limit(2).build().run(List.of(TrackedCollections.ARCHIVES)));
  }
}
