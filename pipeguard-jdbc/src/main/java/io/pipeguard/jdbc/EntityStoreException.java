package io.pipeguard.jdbc;

/**
 * Unchecked wrapper for JDBC failures inside the stores and the JDBC bus.
 */
public class EntityStoreException extends RuntimeException {

  public EntityStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
