package io.pipeguard.jdbc.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.idempotency.DuplicateEntityException;
import io.pipeguard.jdbc.EntityStoreException;
import io.pipeguard.jdbc.JdbcTemplate;
import io.pipeguard.jdbc.TableNames;
import io.pipeguard.model.EntityStatus;
import io.pipeguard.model.TrackedEntity;
import io.pipeguard.spi.EntityStore;
import io.pipeguard.util.Jsons;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC entity store with standard SQL implementations.
 *
 * <p>Every transition is a single conditional {@code UPDATE}; the affected row count tells the
 * caller whether it won. Subclasses may override {@link #upsert} with a native form.
 * Register custom implementations via
 * {@code META-INF/services/io.pipeguard.jdbc.store.AbstractJdbcEntityStore}.
 *
 * @see JdbcEntityStores
 */
public abstract class AbstractJdbcEntityStore implements EntityStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcEntityStore.class.getName());

  protected static final String COLUMNS =
      "collection, entity_id, status, attempt_count, last_attempt_time, trigger_data, created_at";

  protected static final String PENDING = String.valueOf(EntityStatus.PENDING.code());

  protected static final String LAST_ACTIVITY = "COALESCE(last_attempt_time, created_at)";

  protected static final JdbcTemplate.RowMapper<TrackedEntity> ENTITY_ROW_MAPPER = rs -> {
    Timestamp lastAttempt = rs.getTimestamp("last_attempt_time");
    return new TrackedEntity(
        rs.getString("collection"),
        rs.getString("entity_id"),
        EntityStatus.fromCode(rs.getInt("status")),
        rs.getInt("attempt_count"),
        lastAttempt == null ? null : lastAttempt.toInstant(),
        parseTrigger(rs.getString("collection"), rs.getString("entity_id"), rs.getString("trigger_data")),
        rs.getTimestamp("created_at").toInstant());
  };

  private final String tableName;
  private final Clock clock;

  protected AbstractJdbcEntityStore() {
    this(TableNames.ENTITY_TABLE, Clock.systemUTC());
  }

  protected AbstractJdbcEntityStore(String tableName, Clock clock) {
    this.tableName = TableNames.entityTable(tableName);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  protected Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  @Override
  public void insertNew(Connection conn, TrackedEntity entity) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", updated_at) VALUES (?,?,?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          entity.collection(), entity.id(), entity.status().code(), entity.attemptCount(),
          entity.lastAttemptTime(), triggerJson(entity), entity.createdAt(), now());
    } catch (EntityStoreException e) {
      if (JdbcTemplate.isUniqueViolation(e)) {
        throw new DuplicateEntityException(entity.collection(), entity.id(), e.getCause());
      }
      throw e;
    }
  }

  /**
   * Portable upsert: refresh the trigger data of an existing row, otherwise insert. A concurrent
   * insert that wins between the two statements turns into one more refresh.
   */
  @Override
  public void upsert(Connection conn, TrackedEntity entity) {
    if (refreshTrigger(conn, entity) > 0) {
      return;
    }
    try {
      insertNew(conn, entity);
    } catch (DuplicateEntityException e) {
      refreshTrigger(conn, entity);
    }
  }

  private int refreshTrigger(Connection conn, TrackedEntity entity) {
    String sql = "UPDATE " + tableName() + " SET trigger_data=?, updated_at=? WHERE collection=? AND entity_id=?";
    return JdbcTemplate.update(conn, sql, triggerJson(entity), now(), entity.collection(), entity.id());
  }

  @Override
  public Optional<TrackedEntity> find(Connection conn, String collection, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE collection=? AND entity_id=?";
    List<TrackedEntity> rows = JdbcTemplate.query(conn, sql, ENTITY_ROW_MAPPER, collection, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int markProcessed(Connection conn, String collection, String id) {
    return transition(conn, collection, id, EntityStatus.PROCESSED);
  }

  @Override
  public int recordAttempt(Connection conn, String collection, String id, int expectedAttemptCount, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET attempt_count=attempt_count+1, last_attempt_time=?, updated_at=?" +
        " WHERE collection=? AND entity_id=? AND status=" + PENDING + " AND attempt_count=?";
    Instant stamp = now.truncatedTo(ChronoUnit.MILLIS);
    return JdbcTemplate.update(conn, sql, stamp, now(), collection, id, expectedAttemptCount);
  }

  @Override
  public int markFailedMaxRetries(Connection conn, String collection, String id) {
    return transition(conn, collection, id, EntityStatus.FAILED_MAX_RETRIES);
  }

  private int transition(Connection conn, String collection, String id, EntityStatus target) {
    String sql = "UPDATE " + tableName() + " SET status=" + target.code() + ", updated_at=?" +
        " WHERE collection=? AND entity_id=? AND status=" + PENDING;
    return JdbcTemplate.update(conn, sql, now(), collection, id);
  }

  @Override
  public List<TrackedEntity> findStuck(Connection conn, String collection, int maxAttempts, Instant stuckBefore,
      int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE collection=? AND status=" + PENDING + " AND attempt_count<? AND (last_attempt_time IS NULL OR last_attempt_time<?)" +
        " ORDER BY " + LAST_ACTIVITY + ", entity_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTITY_ROW_MAPPER, collection, maxAttempts, stuckBefore, limit);
  }

  @Override
  public List<TrackedEntity> findExhausted(Connection conn, String collection, int maxAttempts, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE collection=? AND status=" + PENDING + " AND attempt_count>=?" +
        " ORDER BY entity_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTITY_ROW_MAPPER, collection, maxAttempts, limit);
  }

  @Override
  public List<TrackedEntity> findIncomplete(Connection conn, String collection, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE collection=? AND status=" + PENDING +
        " ORDER BY created_at, entity_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTITY_ROW_MAPPER, collection, limit);
  }

  @Override
  public long countByStatus(Connection conn, String collection, EntityStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE collection=? AND status=?";
    return JdbcTemplate.queryForLong(conn, sql, collection, status.code());
  }

  protected static String triggerJson(TrackedEntity entity) {
    return entity.triggerData() == null ? null : Jsons.toJson(entity.triggerData());
  }

  // null trigger data marks the row as not replayable
  private static ObjectNode parseTrigger(String collection, String id, String json) {
    try {
      return Jsons.parseObject(json);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Unreadable trigger_data for " + collection + "/" + id, e);
      return null;
    }
  }
}
