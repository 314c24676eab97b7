package io.pipeguard.cli;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.pipeguard.bus.Topology;
import io.pipeguard.bus.ValidatingPublisher;
import io.pipeguard.config.PipelineConfig;
import io.pipeguard.dead.FailedQueueConsole;
import io.pipeguard.jdbc.DataSourceConnectionProvider;
import io.pipeguard.jdbc.SchemaScripts;
import io.pipeguard.jdbc.bus.JdbcMessageBus;
import io.pipeguard.jdbc.store.AbstractJdbcEntityStore;
import io.pipeguard.jdbc.store.JdbcEntityStores;
import io.pipeguard.scan.StuckDocumentScanner;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.PipelineEvents;
import io.pipeguard.schema.SchemaRegistry;
import io.pipeguard.spi.ConnectionProvider;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.stage.PipelineStages;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Wiring shared by every subcommand: one small connection pool, the dialect's entity store,
 * the JDBC bus over the standard topology and a validating publisher.
 */
final class CliContext implements AutoCloseable {
    private final HikariDataSource dataSource;
    private final ConnectionProvider connectionProvider;
    private final AbstractJdbcEntityStore entityStore;
    private final JdbcMessageBus bus;
    private final ValidatingPublisher publisher;
    private final SchemaRegistry registry = PipelineEvents.registry();
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final PipelineConfig config;

    private CliContext(HikariDataSource dataSource, AbstractJdbcEntityStore entityStore, PipelineConfig config) {
        this.dataSource = dataSource;
        this.entityStore = entityStore;
        this.config = config;
        this.connectionProvider = new DataSourceConnectionProvider(dataSource);
        this.bus = JdbcMessageBus.builder()
                .connectionProvider(connectionProvider)
                .topology(Topology.standard())
                .build();
        this.publisher = new ValidatingPublisher(bus, registry, codec, MetricsExporter.NOOP);
    }

    static CliContext open(String jdbcUrl, String user, String password, Map<String, String> environment) {
        PipelineConfig config = PipelineConfig.fromEnvironment(environment);
        AbstractJdbcEntityStore entityStore = JdbcEntityStores.detect(jdbcUrl);
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setUsername(user);
        hikari.setPassword(password);
        hikari.setMaximumPoolSize(2);
        hikari.setPoolName("pipeguard-cli");
        HikariDataSource dataSource = new HikariDataSource(hikari);
        try {
            return new CliContext(dataSource, entityStore, config);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    PipelineConfig config() {
        return config;
    }

    JdbcMessageBus bus() {
        return bus;
    }

    FailedQueueConsole failedQueueConsole() {
        return new FailedQueueConsole(bus, publisher, registry, codec, PipelineStages.standard(),
                MetricsExporter.NOOP, Clock.systemUTC());
    }

    StuckDocumentScanner stuckDocumentScanner(Duration interval) {
        return StuckDocumentScanner.builder()
                .connectionProvider(connectionProvider)
                .entityStore(entityStore)
                .publisher(publisher)
                .collections(config.collections())
                .backoff(config.scannerBackoff())
                .stuckThreshold(config.stuckThreshold())
                .interval(interval != null ? interval : config.scanInterval())
                .batchSize(config.scanBatchSize())
                .build();
    }

    /**
     * Creates the entity and bus tables for the detected dialect.
     *
     * @return the dialect name
     */
    String applySchema() throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            SchemaScripts.apply(conn, entityStore.name());
        }
        return entityStore.name();
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
