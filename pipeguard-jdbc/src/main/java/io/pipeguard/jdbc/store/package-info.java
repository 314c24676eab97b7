/**
 * JDBC {@link io.pipeguard.spi.EntityStore} implementations.
 *
 * <p>{@link io.pipeguard.jdbc.store.AbstractJdbcEntityStore} holds the shared SQL and row
 * mapping; {@link io.pipeguard.jdbc.store.PostgresEntityStore} adds a native upsert.
 *
 * @see io.pipeguard.jdbc.store.JdbcEntityStores
 */
package io.pipeguard.jdbc.store;
