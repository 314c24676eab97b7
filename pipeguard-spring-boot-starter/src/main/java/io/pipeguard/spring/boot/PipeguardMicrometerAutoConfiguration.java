package io.pipeguard.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.pipeguard.micrometer.MicrometerMetricsExporter;
import io.pipeguard.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code pipeguard.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link PipeguardAutoConfiguration} so the exporter is injected into the
 * publisher, scanner and console.
 */
@AutoConfiguration(before = PipeguardAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "pipeguard.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PipeguardProperties.class)
public class PipeguardMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
                                                               PipeguardProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
