package io.pipeguard.jdbc.store;

import io.pipeguard.jdbc.JdbcTemplate;
import io.pipeguard.model.TrackedEntity;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;

/**
 * PostgreSQL entity store.
 *
 * <p>Upserts in one statement with {@code ON CONFLICT ... DO UPDATE}, so a failed insert never
 * aborts the caller's transaction.
 */
public final class PostgresEntityStore extends AbstractJdbcEntityStore {

  public PostgresEntityStore() {
    super();
  }

  public PostgresEntityStore(String tableName, Clock clock) {
    super(tableName, clock);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsert(Connection conn, TrackedEntity entity) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", updated_at) VALUES (?,?,?,?,?,?,?,?)" +
        " ON CONFLICT (collection, entity_id)" +
        " DO UPDATE SET trigger_data=EXCLUDED.trigger_data, updated_at=EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql,
        entity.collection(), entity.id(), entity.status().code(), entity.attemptCount(),
        entity.lastAttemptTime(), triggerJson(entity), entity.createdAt(), now());
  }
}
