package io.pipeguard.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads and applies the bundled DDL under {@code /schema/<dialect>.sql}.
 *
 * <p>Scripts are plain statements separated by {@code ;} and are idempotent
 * ({@code CREATE ... IF NOT EXISTS}).
 */
public final class SchemaScripts {
  private static final Logger logger = Logger.getLogger(SchemaScripts.class.getName());

  private SchemaScripts() {}

  /**
   * Returns the statements of the script for a store name such as {@code "h2"} or {@code "postgresql"}.
   *
   * @throws IllegalArgumentException if no script is bundled for the name
   */
  public static List<String> statements(String dialect) {
    String resource = "/schema/" + dialect.toLowerCase() + ".sql";
    try (InputStream in = SchemaScripts.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for " + dialect + " (" + resource + ")");
      }
      String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      List<String> statements = new ArrayList<>();
      for (String part : sql.split(";")) {
        String trimmed = stripComments(part).trim();
        if (!trimmed.isEmpty()) {
          statements.add(trimmed);
        }
      }
      return statements;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  public static void apply(Connection conn, String dialect) throws SQLException {
    List<String> statements = statements(dialect);
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    }
    logger.info("Applied " + statements.size() + " schema statements for " + dialect);
  }

  private static String stripComments(String sql) {
    StringBuilder sb = new StringBuilder();
    for (String line : sql.split("\n")) {
      if (!line.trim().startsWith("--")) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString();
  }
}
