package io.pipeguard.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC entity stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.pipeguard.jdbc.store.AbstractJdbcEntityStore}.
 *
 * <pre>{@code
 * AbstractJdbcEntityStore store = JdbcEntityStores.detect(dataSource);
 * AbstractJdbcEntityStore pg = JdbcEntityStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEntityStores {

  private static final List<AbstractJdbcEntityStore> STORES;
  private static final Map<String, AbstractJdbcEntityStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcEntityStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEntityStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcEntityStores() {
  }

  public static List<AbstractJdbcEntityStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name (case-insensitive).
   *
   * @throws IllegalArgumentException if no store is registered under the name
   */
  public static AbstractJdbcEntityStore get(String name) {
    AbstractJdbcEntityStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown entity store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource's connection URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcEntityStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect entity store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store matches
   */
  public static AbstractJdbcEntityStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcEntityStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No entity store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
