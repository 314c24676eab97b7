package io.pipeguard.spring.boot;

import io.pipeguard.bus.EventPublisher;
import io.pipeguard.bus.MessageBus;
import io.pipeguard.bus.Topology;
import io.pipeguard.bus.ValidatingPublisher;
import io.pipeguard.config.PipelineConfig;
import io.pipeguard.dead.FailedQueueConsole;
import io.pipeguard.jdbc.DataSourceConnectionProvider;
import io.pipeguard.jdbc.TableNames;
import io.pipeguard.jdbc.bus.JdbcMessageBus;
import io.pipeguard.jdbc.store.AbstractJdbcEntityStore;
import io.pipeguard.jdbc.store.H2EntityStore;
import io.pipeguard.jdbc.store.JdbcEntityStores;
import io.pipeguard.jdbc.store.PostgresEntityStore;
import io.pipeguard.scan.StartupRequeue;
import io.pipeguard.scan.StuckDocumentScanner;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.PipelineEvents;
import io.pipeguard.schema.SchemaRegistry;
import io.pipeguard.spi.ConnectionProvider;
import io.pipeguard.spi.EntityStore;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.stage.PipelineStages;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the delivery-reliability core.
 *
 * <p>Wires the JDBC entity store and JDBC message bus from a {@link DataSource}, a validating
 * publisher over the standard topology, the failed-queue console, and startup requeue. The
 * stuck-document scanner is only started when {@code pipeguard.scanner.enabled=true}.
 *
 * @see PipeguardProperties
 * @see PipeguardMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(StuckDocumentScanner.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(PipeguardProperties.class)
public class PipeguardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PipelineConfig pipelineConfig(PipeguardProperties props) {
        return props.toPipelineConfig();
    }

    @Bean
    @ConditionalOnMissingBean(EntityStore.class)
    public AbstractJdbcEntityStore entityStore(DataSource dataSource, PipeguardProperties props) {
        String tableName = props.getEntityTable();
        AbstractJdbcEntityStore detected = JdbcEntityStores.detect(dataSource);
        if (!TableNames.ENTITY_TABLE.equals(tableName)) {
            return switch (detected.name()) {
                case "h2" -> new H2EntityStore(tableName, Clock.systemUTC());
                case "postgresql" -> new PostgresEntityStore(tableName, Clock.systemUTC());
                default -> detected;
            };
        }
        return detected;
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public Topology topology() {
        return Topology.standard();
    }

    @Bean
    @ConditionalOnMissingBean(MessageBus.class)
    public JdbcMessageBus messageBus(ConnectionProvider connectionProvider, Topology topology,
                                     PipeguardProperties props) {
        return JdbcMessageBus.builder()
                .connectionProvider(connectionProvider)
                .topology(topology)
                .tableName(props.getBus().getTable())
                .visibilityTimeout(props.getBus().getVisibilityTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistry schemaRegistry() {
        return PipelineEvents.registry();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec() {
        return new EnvelopeCodec();
    }

    @Bean
    @ConditionalOnMissingBean(EventPublisher.class)
    public ValidatingPublisher eventPublisher(MessageBus messageBus, SchemaRegistry schemaRegistry,
                                              EnvelopeCodec codec, ObjectProvider<MetricsExporter> metrics) {
        return new ValidatingPublisher(messageBus, schemaRegistry, codec, metricsOrNoop(metrics));
    }

    @Bean
    @ConditionalOnMissingBean
    public FailedQueueConsole failedQueueConsole(MessageBus messageBus, EventPublisher publisher,
                                                 SchemaRegistry schemaRegistry, EnvelopeCodec codec,
                                                 ObjectProvider<MetricsExporter> metrics) {
        return new FailedQueueConsole(messageBus, publisher, schemaRegistry, codec, PipelineStages.standard(),
                metricsOrNoop(metrics), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public StartupRequeue startupRequeue(ConnectionProvider connectionProvider, EntityStore entityStore,
                                         EventPublisher publisher, PipelineConfig config,
                                         ObjectProvider<MetricsExporter> metrics) {
        return StartupRequeue.builder()
                .connectionProvider(connectionProvider)
                .entityStore(entityStore)
                .publisher(publisher)
                .metrics(metricsOrNoop(metrics))
                .enabled(config.enableStartupRequeue())
                .limit(config.startupRequeueLimit())
                .build();
    }

    @Bean
    public ApplicationRunner pipeguardStartupRequeueRunner(StartupRequeue startupRequeue, PipelineConfig config) {
        return args -> startupRequeue.run(config.collections());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pipeguard.scanner", name = "enabled", havingValue = "true")
    public StuckDocumentScanner stuckDocumentScanner(ConnectionProvider connectionProvider, EntityStore entityStore,
                                                     EventPublisher publisher, PipelineConfig config,
                                                     ObjectProvider<MetricsExporter> metrics) {
        return StuckDocumentScanner.builder()
                .connectionProvider(connectionProvider)
                .entityStore(entityStore)
                .publisher(publisher)
                .collections(config.collections())
                .backoff(config.scannerBackoff())
                .stuckThreshold(config.stuckThreshold())
                .interval(config.scanInterval())
                .batchSize(config.scanBatchSize())
                .metrics(metricsOrNoop(metrics))
                .build();
    }

    private static MetricsExporter metricsOrNoop(ObjectProvider<MetricsExporter> metrics) {
        return metrics.getIfAvailable(() -> MetricsExporter.NOOP);
    }
}
