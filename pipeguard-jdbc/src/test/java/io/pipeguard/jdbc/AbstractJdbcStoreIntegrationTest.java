package io.pipeguard.jdbc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.Topology;
import io.pipeguard.idempotency.DuplicateEntityException;
import io.pipeguard.jdbc.bus.JdbcMessageBus;
import io.pipeguard.jdbc.store.AbstractJdbcEntityStore;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.util.Jsons;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store and bus behavior shared by every supported database.
 * Subclasses provide the DataSource and store instance.
 */
abstract class AbstractJdbcStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract AbstractJdbcEntityStore store();

  private static ObjectNode trigger(String id) {
    ObjectNode data = Jsons.object();
    data.put("archive_id", id);
    data.put("source_name", "list-a");
    data.put("file_path", "/data/" + id + ".mbox");
    return data;
  }

  @Test
  void insertFindAndDuplicate() throws Exception {
    Instant created = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(true);
      store().insertNew(conn, TrackedEntity.pending("archives", "a1", trigger("a1"), created));

      TrackedEntity found = store().find(conn, "archives", "a1").orElseThrow();
      assertEquals(created, found.createdAt());
      assertEquals("list-a", found.triggerData().get("source_name").asText());

      assertThrows(DuplicateEntityException.class,
          () -> store().insertNew(conn, TrackedEntity.pending("archives", "a1", trigger("a1"), created)));
    }
  }

  @Test
  void upsertKeepsStatusAndAttempts() throws Exception {
    Instant created = Instant.now().minus(Duration.ofDays(1)).truncatedTo(ChronoUnit.MILLIS);
    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(true);
      store().upsert(conn, TrackedEntity.pending("threads", "t1", trigger("t1"), created));
      store().recordAttempt(conn, "threads", "t1", 0, Instant.now());
      store().markProcessed(conn, "threads", "t1");

      ObjectNode refreshed = trigger("t1");
      refreshed.put("source_name", "list-b");
      store().upsert(conn, TrackedEntity.pending("threads", "t1", refreshed, Instant.now()));

      TrackedEntity found = store().find(conn, "threads", "t1").orElseThrow();
      assertEquals(EntityStatus.PROCESSED, found.status());
      assertEquals(1, found.attemptCount());
      assertEquals("list-b", found.triggerData().get("source_name").asText());
    }
  }

  @Test
  void scanQueriesAndCompareAndSet() throws Exception {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(true);
      store().insertNew(conn, TrackedEntity.pending("chunks", "old", trigger("old"), now.minus(Duration.ofDays(2))));
      store().insertNew(conn, TrackedEntity.pending("chunks", "new", trigger("new"), now));

      List<TrackedEntity> stuck = store().findStuck(conn, "chunks", 5, now.minus(Duration.ofDays(1)), 10);
      assertEquals(List.of("old", "new"), stuck.stream().map(TrackedEntity::id).toList());

      assertEquals(1, store().recordAttempt(conn, "chunks", "old", 0, now));
      assertEquals(0, store().recordAttempt(conn, "chunks", "old", 0, now));
      assertEquals(List.of("new"), store().findStuck(conn, "chunks", 5, now.minus(Duration.ofDays(1)), 10)
          .stream().map(TrackedEntity::id).toList());
      assertEquals(List.of("old"),
          store().findExhausted(conn, "chunks", 1, 10).stream().map(TrackedEntity::id).toList());

      assertEquals(1, store().markFailedMaxRetries(conn, "chunks", "old"));
      assertEquals(1, store().countByStatus(conn, "chunks", EntityStatus.FAILED_MAX_RETRIES));
      assertEquals(List.of("new"),
          store().findIncomplete(conn, "chunks", 10).stream().map(TrackedEntity::id).toList());
    }
  }

  @Test
  void busRoundTrip() {
    JdbcMessageBus bus = JdbcMessageBus.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource()))
        .topology(Topology.standard())
        .build();

    assertEquals(1, bus.publish("json.parsed", "{\"archive_id\":\"a1\"}"));
    assertEquals(1, bus.peek("json.parsed", 10).size());

    List<Delivery> fetched = bus.fetch("json.parsed", "it-worker", 10);
    assertEquals(1, fetched.size());
    assertTrue(bus.fetch("json.parsed", "it-worker-2", 10).isEmpty());

    bus.nack(fetched.get(0), true);
    Delivery again = bus.fetch("json.parsed", "it-worker-2", 10).get(0);
    assertEquals(2, again.deliveryCount());

    bus.ack(again);
    assertEquals(0, bus.depth("json.parsed"));
  }
}
