package io.pipeguard.jdbc.bus;

import com.github.f4b6a3.ulid.UlidCreator;
import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.MessageBus;
import io.pipeguard.bus.MessageBusException;
import io.pipeguard.bus.Topology;
import io.pipeguard.jdbc.EntityStoreException;
import io.pipeguard.jdbc.JdbcTemplate;
import io.pipeguard.jdbc.TableNames;
import io.pipeguard.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MessageBus} persisted in a relational table, one row per queued copy of a message.
 *
 * <p>A fetch claims rows with a conditional {@code UPDATE} that stamps a per-call claim token
 * and bumps {@code delivery_count}. Claimed rows become visible again once the visibility
 * timeout passes without an ack or nack, which is how a crashed consumer's messages are
 * redelivered. Ack and nack match on {@code delivery_count}, so a consumer whose claim
 * expired and was taken over cannot settle the newer delivery.
 *
 * <p>Publishing to several bound queues is done in one transaction.
 */
public final class JdbcMessageBus implements MessageBus {
  private static final Logger logger = Logger.getLogger(JdbcMessageBus.class.getName());

  private static final String COLUMNS =
      "message_id, queue_name, routing_key, body, delivery_count, enqueued_at";

  private static final JdbcTemplate.RowMapper<Delivery> DELIVERY_ROW_MAPPER = rs -> new Delivery(
      rs.getString("message_id"),
      rs.getString("queue_name"),
      rs.getString("routing_key"),
      rs.getString("body"),
      rs.getInt("delivery_count"),
      rs.getTimestamp("enqueued_at").toInstant());

  private final ConnectionProvider connectionProvider;
  private final Topology topology;
  private final String tableName;
  private final Duration visibilityTimeout;
  private final Clock clock;

  private JdbcMessageBus(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.topology = Objects.requireNonNull(builder.topology, "topology");
    this.tableName = TableNames.busTable(builder.tableName);
    this.visibilityTimeout = Objects.requireNonNull(builder.visibilityTimeout, "visibilityTimeout");
    if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) {
      throw new IllegalArgumentException("visibilityTimeout must be positive");
    }
    this.clock = Objects.requireNonNull(builder.clock, "clock");
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public int publish(String routingKey, String body) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(body, "body");
    List<String> queues = topology.queuesFor(routingKey);
    if (queues.isEmpty()) {
      return 0;
    }
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ", locked_by, locked_at)" +
        " VALUES (?,?,?,?,0,?,NULL,NULL)";
    Instant now = now();
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        for (String queue : queues) {
          JdbcTemplate.update(conn, sql, UlidCreator.getMonotonicUlid().toString(), queue, routingKey, body, now);
        }
        conn.commit();
      } catch (RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException | EntityStoreException e) {
      throw new MessageBusException("Failed to publish " + routingKey, e);
    }
    return queues.size();
  }

  @Override
  public List<Delivery> fetch(String queue, String consumerId, int limit) {
    requireQueue(queue);
    Objects.requireNonNull(consumerId, "consumerId");
    if (limit <= 0) {
      return List.of();
    }
    Instant now = now();
    Instant expiredBefore = now.minus(visibilityTimeout);
    String token = consumerId + "#" + UlidCreator.getMonotonicUlid();
    // outer predicate repeats the visibility check so a row re-read after a concurrent claim is skipped
    String claimSql = "UPDATE " + tableName +
        " SET locked_by=?, locked_at=?, delivery_count=delivery_count+1" +
        " WHERE queue_name=? AND (locked_by IS NULL OR locked_at<?) AND message_id IN (" +
        "SELECT message_id FROM " + tableName +
        " WHERE queue_name=? AND (locked_by IS NULL OR locked_at<?)" +
        " ORDER BY enqueued_at, message_id LIMIT ?)";
    String selectSql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE locked_by=? ORDER BY enqueued_at, message_id";
    return withConnection("fetch from " + queue, conn -> {
      int claimed = JdbcTemplate.update(conn, claimSql,
          token, now, queue, expiredBefore, queue, expiredBefore, limit);
      if (claimed == 0) {
        return List.of();
      }
      return JdbcTemplate.query(conn, selectSql, DELIVERY_ROW_MAPPER, token);
    });
  }

  @Override
  public void ack(Delivery delivery) {
    String sql = "DELETE FROM " + tableName + " WHERE message_id=? AND delivery_count=?";
    int deleted = withConnection("ack " + delivery.messageId(), conn ->
        JdbcTemplate.update(conn, sql, delivery.messageId(), delivery.deliveryCount()));
    if (deleted == 0) {
      logger.log(Level.WARNING, "Stale ack ignored: message {0} delivery {1} in {2}",
          new Object[]{delivery.messageId(), delivery.deliveryCount(), delivery.queue()});
    }
  }

  @Override
  public void nack(Delivery delivery, boolean requeue) {
    String sql = requeue
        ? "UPDATE " + tableName + " SET locked_by=NULL, locked_at=NULL WHERE message_id=? AND delivery_count=?"
        : "DELETE FROM " + tableName + " WHERE message_id=? AND delivery_count=?";
    int affected = withConnection("nack " + delivery.messageId(), conn ->
        JdbcTemplate.update(conn, sql, delivery.messageId(), delivery.deliveryCount()));
    if (affected == 0) {
      logger.log(Level.WARNING, "Stale nack ignored: message {0} delivery {1} in {2}",
          new Object[]{delivery.messageId(), delivery.deliveryCount(), delivery.queue()});
    }
  }

  @Override
  public List<Delivery> peek(String queue, int limit) {
    requireQueue(queue);
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE queue_name=? AND (locked_by IS NULL OR locked_at<?)" +
        " ORDER BY enqueued_at, message_id LIMIT ?";
    Instant expiredBefore = now().minus(visibilityTimeout);
    return withConnection("peek " + queue, conn ->
        JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, queue, expiredBefore, limit));
  }

  @Override
  public int depth(String queue) {
    requireQueue(queue);
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE queue_name=?";
    return Math.toIntExact(withConnection("depth of " + queue, conn -> JdbcTemplate.queryForLong(conn, sql, queue)));
  }

  @Override
  public Topology topology() {
    return topology;
  }

  private void requireQueue(String queue) {
    if (!topology.queues().contains(queue)) {
      throw new MessageBusException("Unknown queue: " + queue);
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private <T> T withConnection(String action, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      return work.run(conn);
    } catch (SQLException | EntityStoreException e) {
      throw new MessageBusException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link JdbcMessageBus}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Topology topology;
    private String tableName = TableNames.BUS_TABLE;
    private Duration visibilityTimeout = Duration.ofMinutes(5);
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Routing-key to queue bindings.
     *
     * <p><b>Required.</b>
     */
    public Builder topology(Topology topology) {
      this.topology = topology;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code bus_message}.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * How long a fetched but unsettled message stays hidden before it is redelivered.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JdbcMessageBus build() {
      return new JdbcMessageBus(this);
    }
  }
}
