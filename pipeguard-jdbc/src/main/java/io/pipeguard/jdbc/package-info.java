/**
 * JDBC plumbing shared by the entity stores and the JDBC message bus: statement helpers,
 * the {@link io.pipeguard.spi.ConnectionProvider} over a DataSource, and the bundled DDL.
 */
package io.pipeguard.jdbc;
