package io.pipeguard.jdbc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.idempotency.DuplicateEntityException;
import io.pipeguard.jdbc.store.H2EntityStore;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.util.Jsons;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2EntityStoreTest {
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private JdbcDataSource dataSource;
  private H2EntityStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }
    store = new H2EntityStore(TableNames.ENTITY_TABLE, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static ObjectNode trigger(String archiveId) {
    ObjectNode data = Jsons.object();
    data.put("archive_id", archiveId);
    data.put("source_name", "list-a");
    data.put("file_path", "/data/" + archiveId + ".mbox");
    return data;
  }

  private static TrackedEntity pending(String id, Instant createdAt) {
    return TrackedEntity.pending("archives", id, trigger(id), createdAt);
  }

  @Test
  void insertNewPersistsPendingEntity() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW.minus(Duration.ofHours(1))));

      TrackedEntity found = store.find(conn, "archives", "a1").orElseThrow();
      assertEquals(EntityStatus.PENDING, found.status());
      assertEquals(0, found.attemptCount());
      assertNull(found.lastAttemptTime());
      assertEquals(NOW.minus(Duration.ofHours(1)), found.createdAt());
      assertEquals("/data/a1.mbox", found.triggerData().get("file_path").asText());
    }
  }

  @Test
  void insertNewRejectsDuplicateId() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW));

      DuplicateEntityException ex = assertThrows(DuplicateEntityException.class,
          () -> store.insertNew(conn, pending("a1", NOW)));
      assertEquals("archives", ex.collection());
      assertEquals("a1", ex.entityId());
    }
  }

  @Test
  void sameIdInAnotherCollectionIsNotADuplicate() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("x", NOW));
      store.insertNew(conn, TrackedEntity.pending("messages", "x", trigger("x"), NOW));

      assertTrue(store.find(conn, "messages", "x").isPresent());
    }
  }

  @Test
  void upsertRefreshesTriggerButKeepsAttemptTracking() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, pending("a1", NOW.minus(Duration.ofDays(2))));
      assertEquals(1, store.recordAttempt(conn, "archives", "a1", 0, NOW.minus(Duration.ofDays(1))));

      ObjectNode newer = trigger("a1");
      newer.put("file_path", "/data/a1-v2.mbox");
      store.upsert(conn, TrackedEntity.pending("archives", "a1", newer, NOW));

      TrackedEntity found = store.find(conn, "archives", "a1").orElseThrow();
      assertEquals(1, found.attemptCount());
      assertEquals(NOW.minus(Duration.ofDays(1)), found.lastAttemptTime());
      assertEquals(NOW.minus(Duration.ofDays(2)), found.createdAt());
      assertEquals("/data/a1-v2.mbox", found.triggerData().get("file_path").asText());
    }
  }

  @Test
  void markProcessedTransitionsOnlyOnce() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW));

      assertEquals(1, store.markProcessed(conn, "archives", "a1"));
      assertEquals(0, store.markProcessed(conn, "archives", "a1"));
      assertEquals(0, store.markFailedMaxRetries(conn, "archives", "a1"));
      assertEquals(EntityStatus.PROCESSED, store.find(conn, "archives", "a1").orElseThrow().status());
    }
  }

  @Test
  void failedEntityIsNotReopenedByProcessing() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW));

      assertEquals(1, store.markFailedMaxRetries(conn, "archives", "a1"));
      assertEquals(0, store.markProcessed(conn, "archives", "a1"));
      assertEquals(0, store.recordAttempt(conn, "archives", "a1", 0, NOW));
    }
  }

  @Test
  void recordAttemptIsCompareAndSet() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW.minus(Duration.ofDays(1))));

      assertEquals(1, store.recordAttempt(conn, "archives", "a1", 0, NOW));
      assertEquals(0, store.recordAttempt(conn, "archives", "a1", 0, NOW));

      TrackedEntity found = store.find(conn, "archives", "a1").orElseThrow();
      assertEquals(1, found.attemptCount());
      assertEquals(NOW, found.lastAttemptTime());
    }
  }

  @Test
  void findStuckTakesNeverAttemptedAndStaleAttemptsBelowCeiling() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      Instant old = NOW.minus(Duration.ofDays(3));
      store.insertNew(conn, pending("never-attempted", old));
      store.insertNew(conn, pending("recently-attempted", old));
      store.recordAttempt(conn, "archives", "recently-attempted", 0, NOW.minus(Duration.ofHours(1)));
      store.insertNew(conn, pending("stale-attempt", old));
      store.recordAttempt(conn, "archives", "stale-attempt", 0, NOW.minus(Duration.ofDays(2)));
      store.insertNew(conn, pending("fresh", NOW));
      store.insertNew(conn, new TrackedEntity("archives", "exhausted", EntityStatus.PENDING, 3,
          old, trigger("exhausted"), old));
      store.insertNew(conn, pending("done", old));
      store.markProcessed(conn, "archives", "done");

      List<TrackedEntity> stuck = store.findStuck(conn, "archives", 3, NOW.minus(Duration.ofDays(1)), 10);
      assertEquals(List.of("never-attempted", "stale-attempt", "fresh"),
          stuck.stream().map(TrackedEntity::id).toList());

      List<TrackedEntity> exhausted = store.findExhausted(conn, "archives", 3, 10);
      assertEquals(List.of("exhausted"), exhausted.stream().map(TrackedEntity::id).toList());
    }
  }

  @Test
  void findStuckOrdersByLastActivityAndHonorsLimit() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("b", NOW.minus(Duration.ofDays(2))));
      store.insertNew(conn, pending("a", NOW.minus(Duration.ofDays(5))));
      store.insertNew(conn, pending("c", NOW.minus(Duration.ofDays(4))));

      List<TrackedEntity> stuck = store.findStuck(conn, "archives", 3, NOW.minus(Duration.ofDays(1)), 2);
      assertEquals(List.of("a", "c"), stuck.stream().map(TrackedEntity::id).toList());
    }
  }

  @Test
  void findIncompleteReturnsEveryPendingEntityOldestFirst() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("new", NOW));
      store.insertNew(conn, pending("old", NOW.minus(Duration.ofMinutes(5))));
      store.insertNew(conn, pending("done", NOW.minus(Duration.ofDays(1))));
      store.markProcessed(conn, "archives", "done");

      List<TrackedEntity> incomplete = store.findIncomplete(conn, "archives", 10);
      assertEquals(List.of("old", "new"), incomplete.stream().map(TrackedEntity::id).toList());
    }
  }

  @Test
  void countByStatusIsScopedToCollection() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertNew(conn, pending("a1", NOW));
      store.insertNew(conn, pending("a2", NOW));
      store.insertNew(conn, TrackedEntity.pending("messages", "m1", trigger("m1"), NOW));
      store.markFailedMaxRetries(conn, "archives", "a2");

      assertEquals(1, store.countByStatus(conn, "archives", EntityStatus.PENDING));
      assertEquals(1, store.countByStatus(conn, "archives", EntityStatus.FAILED_MAX_RETRIES));
      assertEquals(0, store.countByStatus(conn, "messages", EntityStatus.FAILED_MAX_RETRIES));
    }
  }

  @Test
  void unreadableTriggerDataMapsToNull() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO tracked_entity (collection, entity_id, status, attempt_count, trigger_data, created_at, updated_at)"
              + " VALUES ('archives', 'broken', 0, 0, 'not json', ?, ?)")) {
        ps.setTimestamp(1, Timestamp.from(NOW));
        ps.setTimestamp(2, Timestamp.from(NOW));
        ps.executeUpdate();
      }

      TrackedEntity found = store.find(conn, "archives", "broken").orElseThrow();
      assertNull(found.triggerData());
    }
  }

  @Test
  void rejectsUnsafeTableName() {
    assertThrows(IllegalArgumentException.class,
        () -> new H2EntityStore("tracked_entity; DROP TABLE x", Clock.systemUTC()));
  }
}
