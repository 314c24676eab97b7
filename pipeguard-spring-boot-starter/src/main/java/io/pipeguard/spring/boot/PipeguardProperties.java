package io.pipeguard.spring.boot;

import io.pipeguard.config.PipelineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the delivery-reliability core.
 *
 * <p>Retry, scanner and startup-requeue settings mirror {@link PipelineConfig}; use
 * {@link #toPipelineConfig()} to obtain the validated struct.
 *
 * @see PipeguardAutoConfiguration
 */
@ConfigurationProperties(prefix = "pipeguard")
public class PipeguardProperties {

    /**
     * Table holding tracked entities.
     */
    private String entityTable = "tracked_entity";

    private final Bus bus = new Bus();
    private final Retry retry = new Retry();
    private final Scanner scanner = new Scanner();
    private final StartupRequeue startupRequeue = new StartupRequeue();
    private final Metrics metrics = new Metrics();

    public String getEntityTable() {
        return entityTable;
    }

    public void setEntityTable(String entityTable) {
        this.entityTable = entityTable;
    }

    public Bus getBus() {
        return bus;
    }

    public Retry getRetry() {
        return retry;
    }

    public Scanner getScanner() {
        return scanner;
    }

    public StartupRequeue getStartupRequeue() {
        return startupRequeue;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Builds the immutable pipeline configuration from these properties.
     *
     * @throws IllegalArgumentException if a value is out of range or a collection is unknown
     */
    public PipelineConfig toPipelineConfig() {
        PipelineConfig.Builder builder = PipelineConfig.builder()
                .retryBackoffBase(retry.getBackoffBase())
                .retryBackoffCap(retry.getBackoffCap())
                .inProcessMaxAttempts(retry.getInProcess().getMaxAttempts())
                .inProcessBackoffBase(retry.getInProcess().getBackoffBase())
                .inProcessBackoffCap(retry.getInProcess().getBackoffCap())
                .stuckThreshold(scanner.getStuckThreshold())
                .scanInterval(scanner.getInterval())
                .scanBatchSize(scanner.getBatchSize())
                .enableStartupRequeue(startupRequeue.isEnabled())
                .startupRequeueLimit(startupRequeue.getLimit());
        retry.getMaxRetries().forEach(builder::maxRetries);
        return builder.build();
    }

    public static class Bus {
        /**
         * Table holding queued messages for the JDBC bus.
         */
        private String table = "bus_message";

        /**
         * How long a fetched message stays hidden before it is redelivered.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(5);

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }
    }

    public static class Retry {
        /**
         * Attempt ceiling per tracked collection, e.g. {@code pipeguard.retry.max-retries.chunks=8}.
         * Collections not listed keep their defaults.
         */
        private Map<String, Integer> maxRetries = new LinkedHashMap<>();
        private Duration backoffBase = Duration.ofSeconds(300);
        private Duration backoffCap = Duration.ofSeconds(3600);
        private final InProcess inProcess = new InProcess();

        public Map<String, Integer> getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Map<String, Integer> maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getBackoffCap() {
            return backoffCap;
        }

        public void setBackoffCap(Duration backoffCap) {
            this.backoffCap = backoffCap;
        }

        public InProcess getInProcess() {
            return inProcess;
        }
    }

    public static class InProcess {
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(5);
        private Duration backoffCap = Duration.ofSeconds(60);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getBackoffCap() {
            return backoffCap;
        }

        public void setBackoffCap(Duration backoffCap) {
            this.backoffCap = backoffCap;
        }
    }

    public static class Scanner {
        /**
         * Run the stuck-document scanner inside this application. Usually one dedicated
         * deployment runs it instead.
         */
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(15);
        private Duration stuckThreshold = Duration.ofHours(24);
        private int batchSize = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getStuckThreshold() {
            return stuckThreshold;
        }

        public void setStuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class StartupRequeue {
        private boolean enabled = true;
        private int limit = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "pipeguard";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
