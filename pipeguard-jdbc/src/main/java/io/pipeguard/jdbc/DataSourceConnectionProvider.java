package io.pipeguard.jdbc;

import io.pipeguard.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} for the bus, the entity store and the scanner, backed by one shared
 * {@link DataSource}. A failed checkout is rethrown with the SQL state kept, so callers can still
 * classify it as transient.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw new SQLException("Cannot obtain a pipeguard database connection: " + e.getMessage(),
          e.getSQLState(), e.getErrorCode(), e);
    }
  }
}
