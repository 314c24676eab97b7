package io.pipeguard.jdbc;

import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.MessageBusException;
import io.pipeguard.bus.Topology;
import io.pipeguard.jdbc.bus.JdbcMessageBus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcMessageBusTest {
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private final Topology topology = Topology.builder()
      .bind("archive.ingested", "archive.ingested")
      .bind("archive.ingested", "audit")
      .bind("json.parsed", "json.parsed")
      .build();

  private DataSourceConnectionProvider connectionProvider;
  private JdbcMessageBus bus;

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    bus = busAt(NOW);
  }

  private JdbcMessageBus busAt(Instant instant) {
    return JdbcMessageBus.builder()
        .connectionProvider(connectionProvider)
        .topology(topology)
        .visibilityTimeout(Duration.ofMinutes(5))
        .clock(Clock.fixed(instant, ZoneOffset.UTC))
        .build();
  }

  @Test
  void publishFansOutToEveryBoundQueue() {
    assertEquals(2, bus.publish("archive.ingested", "{\"n\":1}"));

    assertEquals(1, bus.depth("archive.ingested"));
    assertEquals(1, bus.depth("audit"));
    assertEquals(0, bus.depth("json.parsed"));
  }

  @Test
  void publishToUnboundKeyIsDiscarded() {
    assertEquals(0, bus.publish("nobody.listens", "{}"));
  }

  @Test
  void fetchClaimsOldestFirstAndHidesClaimedMessages() {
    bus.publish("json.parsed", "{\"n\":1}");
    bus.publish("json.parsed", "{\"n\":2}");
    bus.publish("json.parsed", "{\"n\":3}");

    List<Delivery> first = bus.fetch("json.parsed", "worker-1", 2);
    assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), first.stream().map(Delivery::body).toList());
    assertTrue(first.stream().allMatch(d -> d.deliveryCount() == 1));
    assertEquals("json.parsed", first.get(0).routingKey());

    List<Delivery> second = bus.fetch("json.parsed", "worker-2", 5);
    assertEquals(1, second.size());
    assertEquals("{\"n\":3}", second.get(0).body());

    assertTrue(bus.fetch("json.parsed", "worker-3", 5).isEmpty());
    assertEquals(3, bus.depth("json.parsed"));
  }

  @Test
  void ackRemovesTheMessage() {
    bus.publish("json.parsed", "{}");
    Delivery delivery = bus.fetch("json.parsed", "worker-1", 1).get(0);

    bus.ack(delivery);

    assertEquals(0, bus.depth("json.parsed"));
  }

  @Test
  void nackWithRequeueMakesMessageVisibleAgain() {
    bus.publish("json.parsed", "{}");
    Delivery delivery = bus.fetch("json.parsed", "worker-1", 1).get(0);

    bus.nack(delivery, true);

    Delivery again = bus.fetch("json.parsed", "worker-1", 1).get(0);
    assertEquals(delivery.messageId(), again.messageId());
    assertEquals(2, again.deliveryCount());
    assertTrue(again.isRedelivery());
  }

  @Test
  void nackWithoutRequeueDiscards() {
    bus.publish("json.parsed", "{}");
    Delivery delivery = bus.fetch("json.parsed", "worker-1", 1).get(0);

    bus.nack(delivery, false);

    assertEquals(0, bus.depth("json.parsed"));
  }

  @Test
  void expiredClaimIsRedeliveredAndStaleAckIsIgnored() {
    bus.publish("json.parsed", "{}");
    Delivery crashed = bus.fetch("json.parsed", "worker-1", 1).get(0);

    JdbcMessageBus later = busAt(NOW.plus(Duration.ofMinutes(6)));
    Delivery redelivered = later.fetch("json.parsed", "worker-2", 1).get(0);
    assertEquals(crashed.messageId(), redelivered.messageId());
    assertEquals(2, redelivered.deliveryCount());

    later.ack(crashed);
    assertEquals(1, later.depth("json.parsed"));

    later.ack(redelivered);
    assertEquals(0, later.depth("json.parsed"));
  }

  @Test
  void claimWithinVisibilityTimeoutStaysHidden() {
    bus.publish("json.parsed", "{}");
    bus.fetch("json.parsed", "worker-1", 1);

    JdbcMessageBus later = busAt(NOW.plus(Duration.ofMinutes(4)));
    assertTrue(later.fetch("json.parsed", "worker-2", 1).isEmpty());
    assertTrue(later.peek("json.parsed", 10).isEmpty());
  }

  @Test
  void peekDoesNotClaim() {
    bus.publish("json.parsed", "{\"n\":1}");

    List<Delivery> peeked = bus.peek("json.parsed", 10);
    assertEquals(1, peeked.size());
    assertEquals(0, peeked.get(0).deliveryCount());

    assertEquals(1, bus.fetch("json.parsed", "worker-1", 10).size());
  }

  @Test
  void unknownQueueIsRejected() {
    assertThrows(MessageBusException.class, () -> bus.fetch("no.such.queue", "worker-1", 1));
    assertThrows(MessageBusException.class, () -> bus.depth("no.such.queue"));
    assertThrows(MessageBusException.class, () -> bus.peek("no.such.queue", 1));
  }

  @Test
  void missingTableSurfacesAsBusFailure() {
    JdbcMessageBus misconfigured = JdbcMessageBus.builder()
        .connectionProvider(connectionProvider)
        .topology(topology)
        .tableName("missing_table")
        .build();

    assertThrows(MessageBusException.class, () -> misconfigured.publish("json.parsed", "{}"));
  }

  @Test
  void rejectsNonPositiveVisibilityTimeout() {
    assertThrows(IllegalArgumentException.class, () -> JdbcMessageBus.builder()
        .connectionProvider(connectionProvider)
        .topology(topology)
        .visibilityTimeout(Duration.ZERO)
        .build());
  }
}
