package io.pipeguard.jdbc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.Topology;
import io.pipeguard.bus.ValidatingPublisher;
import io.pipeguard.jdbc.bus.JdbcMessageBus;
import io.pipeguard.jdbc.store.H2EntityStore;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedCollections;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.scan.ScanReport;
import io.pipeguard.scan.StartupRequeue;
import io.pipeguard.scan.StuckDocumentScanner;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.PipelineEvents;
import io.pipeguard.util.Jsons;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scanner and startup requeue running against the H2 store and the JDBC bus.
 */
class JdbcScannerIntegrationTest {
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private DataSourceConnectionProvider connectionProvider;
  private H2EntityStore store;
  private JdbcMessageBus bus;
  private ValidatingPublisher publisher;

  @BeforeEach
  void setUp() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    store = new H2EntityStore();
    bus = JdbcMessageBus.builder()
        .connectionProvider(connectionProvider)
        .topology(Topology.standard())
        .build();
    publisher = new ValidatingPublisher(bus, PipelineEvents.registry());
  }

  private void insertArchive(String id, Instant createdAt) throws Exception {
    ObjectNode data = Jsons.object();
    data.put("archive_id", id);
    data.put("source_name", "list-a");
    data.put("file_path", "/data/" + id + ".mbox");
    try (Connection conn = connectionProvider.getConnection()) {
      store.insertNew(conn, TrackedEntity.pending("archives", id, data, createdAt));
    }
  }

  private StuckDocumentScanner scannerAt(Instant instant) {
    return StuckDocumentScanner.builder()
        .connectionProvider(connectionProvider)
        .entityStore(store)
        .publisher(publisher)
        .collections(List.of(TrackedCollections.ARCHIVES))
        .clock(Clock.fixed(instant, ZoneOffset.UTC))
        .build();
  }

  @Test
  void stuckArchiveIsRepublishedUntilMarkedFailed() throws Exception {
    insertArchive("a1", NOW.minus(Duration.ofDays(2)));

    ScanReport first = scannerAt(NOW).scanOnce();
    assertEquals(1, first.collection("archives").requeued());

    List<Delivery> queued = bus.peek("archive.ingested", 10);
    assertEquals(1, queued.size());
    Envelope replayed = new EnvelopeCodec().decode(queued.get(0).body());
    assertEquals("a1", replayed.text("archive_id"));

    scannerAt(NOW.plus(Duration.ofDays(2))).scanOnce();
    ScanReport third = scannerAt(NOW.plus(Duration.ofDays(4))).scanOnce();
    assertEquals(1, third.collection("archives").markedFailed());

    try (Connection conn = connectionProvider.getConnection()) {
      TrackedEntity entity = store.find(conn, "archives", "a1").orElseThrow();
      assertEquals(EntityStatus.FAILED_MAX_RETRIES, entity.status());
      assertEquals(3, entity.attemptCount());
    }
    assertEquals(2, bus.depth("archive.ingested"));
  }

  @Test
  void secondPassAtSameInstantDoesNotRepublish() throws Exception {
    insertArchive("a1", NOW.minus(Duration.ofDays(2)));

    ScanReport first = scannerAt(NOW).scanOnce();
    ScanReport second = scannerAt(NOW).scanOnce();

    assertEquals(1, first.collection("archives").requeued());
    assertEquals(0, second.collection("archives").requeued());
    assertEquals(1, bus.depth("archive.ingested"));
  }

  @Test
  void startupRequeueRepublishesWithoutCountingAttempts() throws Exception {
    insertArchive("a1", NOW);
    insertArchive("a2", NOW);

    int requeued = StartupRequeue.builder()
        .connectionProvider(connectionProvider)
        .entityStore(store)
        .publisher(publisher)
        .build()
        .run(TrackedCollections.standard());

    assertEquals(2, requeued);
    assertEquals(2, bus.depth("archive.ingested"));
    try (Connection conn = connectionProvider.getConnection()) {
      assertEquals(0, store.find(conn, "archives", "a1").orElseThrow().attemptCount());
    }
  }
}
