package io.pipeguard.jdbc;

import java.util.Objects;

/**
 * Names of the two pipeguard tables. Both are concatenated into SQL, so overrides must be plain
 * unquoted identifiers that fit PostgreSQL's identifier limit.
 */
public final class TableNames {
  public static final String ENTITY_TABLE = "tracked_entity";
  public static final String BUS_TABLE = "bus_message";

  static final int MAX_LENGTH = 63;
  private static final String IDENTIFIER = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /** Validates an override of the tracked entity table ({@value #ENTITY_TABLE}). */
  public static String entityTable(String tableName) {
    return validate("tracked entity", ENTITY_TABLE, tableName);
  }

  /** Validates an override of the message bus table ({@value #BUS_TABLE}). */
  public static String busTable(String tableName) {
    return validate("message bus", BUS_TABLE, tableName);
  }

  private static String validate(String role, String defaultName, String tableName) {
    Objects.requireNonNull(tableName, role + " table name");
    if (tableName.length() > MAX_LENGTH || !tableName.matches(IDENTIFIER)) {
      throw new IllegalArgumentException("Invalid " + role + " table name '" + tableName
          + "': expected an unquoted identifier of at most " + MAX_LENGTH
          + " characters, such as " + defaultName);
    }
    return tableName;
  }
}
