package io.pipeguard.jdbc.store;

import java.time.Clock;
import java.util.List;

/**
 * H2 entity store. Primarily for tests and local runs.
 *
 * <p>Uses the portable update-then-insert upsert from {@link AbstractJdbcEntityStore}.
 */
public final class H2EntityStore extends AbstractJdbcEntityStore {

  public H2EntityStore() {
    super();
  }

  public H2EntityStore(String tableName, Clock clock) {
    super(tableName, clock);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
