package io.pipeguard.config;

import io.pipeguard.model.TrackedCollection;
import io.pipeguard.model.TrackedCollections;
import io.pipeguard.retry.ExponentialBackoffRetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reliability settings shared by the retry executor, the scanner and startup requeue.
 *
 * <p>Built once at startup and passed to components at construction; nothing reads the
 * environment after that. {@link #fromEnvironment(Map)} maps the deployment's environment
 * variables onto the builder.
 */
public final class PipelineConfig {
    public static final String ENV_MAX_RETRIES_PREFIX = "MAX_RETRIES_";
    public static final String ENV_RETRY_BACKOFF_BASE_SECONDS = "RETRY_BACKOFF_BASE_SECONDS";
    public static final String ENV_RETRY_BACKOFF_CAP_SECONDS = "RETRY_BACKOFF_CAP_SECONDS";
    public static final String ENV_STUCK_THRESHOLD_HOURS = "STUCK_THRESHOLD_HOURS";
    public static final String ENV_SCAN_INTERVAL_SECONDS = "SCAN_INTERVAL_SECONDS";
    public static final String ENV_ENABLE_STARTUP_REQUEUE = "ENABLE_STARTUP_REQUEUE";
    public static final String ENV_INPROCESS_MAX_ATTEMPTS = "INPROCESS_MAX_ATTEMPTS";
    public static final String ENV_INPROCESS_BACKOFF_BASE_SECONDS = "INPROCESS_BACKOFF_BASE_SECONDS";
    public static final String ENV_INPROCESS_BACKOFF_CAP_SECONDS = "INPROCESS_BACKOFF_CAP_SECONDS";

    private final Map<String, Integer> maxRetries;
    private final Duration retryBackoffBase;
    private final Duration retryBackoffCap;
    private final Duration stuckThreshold;
    private final Duration scanInterval;
    private final int scanBatchSize;
    private final boolean enableStartupRequeue;
    private final int startupRequeueLimit;
    private final int inProcessMaxAttempts;
    private final Duration inProcessBackoffBase;
    private final Duration inProcessBackoffCap;

    private PipelineConfig(Builder builder) {
        for (Map.Entry<String, Integer> e : builder.maxRetries.entrySet()) {
            requirePositive(e.getValue(), "maxRetries[" + e.getKey() + "]");
        }
        this.maxRetries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.maxRetries));
        this.retryBackoffBase = requirePositive(builder.retryBackoffBase, "retryBackoffBase");
        this.retryBackoffCap = requirePositive(builder.retryBackoffCap, "retryBackoffCap");
        if (retryBackoffCap.compareTo(retryBackoffBase) < 0) {
            throw new IllegalArgumentException("retryBackoffCap must be >= retryBackoffBase");
        }
        this.stuckThreshold = Objects.requireNonNull(builder.stuckThreshold, "stuckThreshold");
        if (stuckThreshold.isNegative()) {
            throw new IllegalArgumentException("stuckThreshold must be >= 0");
        }
        this.scanInterval = requirePositive(builder.scanInterval, "scanInterval");
        this.scanBatchSize = requirePositive(builder.scanBatchSize, "scanBatchSize");
        this.enableStartupRequeue = builder.enableStartupRequeue;
        this.startupRequeueLimit = requirePositive(builder.startupRequeueLimit, "startupRequeueLimit");
        this.inProcessMaxAttempts = requirePositive(builder.inProcessMaxAttempts, "inProcessMaxAttempts");
        this.inProcessBackoffBase = requirePositive(builder.inProcessBackoffBase, "inProcessBackoffBase");
        this.inProcessBackoffCap = requirePositive(builder.inProcessBackoffCap, "inProcessBackoffCap");
        if (inProcessBackoffCap.compareTo(inProcessBackoffBase) < 0) {
            throw new IllegalArgumentException("inProcessBackoffCap must be >= inProcessBackoffBase");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config from environment variables, falling back to defaults for unset ones.
     *
     * @throws IllegalArgumentException naming the variable if a value is not valid
     */
    public static PipelineConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();
        for (TrackedCollection collection : TrackedCollections.standard()) {
            String var = ENV_MAX_RETRIES_PREFIX + collection.name().toUpperCase(Locale.ROOT);
            Integer value = intValue(env, var);
            if (value != null) {
                builder.maxRetries(collection.name(), value);
            }
        }
        Integer v;
        if ((v = intValue(env, ENV_RETRY_BACKOFF_BASE_SECONDS)) != null) {
            builder.retryBackoffBase(Duration.ofSeconds(v));
        }
        if ((v = intValue(env, ENV_RETRY_BACKOFF_CAP_SECONDS)) != null) {
            builder.retryBackoffCap(Duration.ofSeconds(v));
        }
        if ((v = intValue(env, ENV_STUCK_THRESHOLD_HOURS)) != null) {
            builder.stuckThreshold(Duration.ofHours(v));
        }
        if ((v = intValue(env, ENV_SCAN_INTERVAL_SECONDS)) != null) {
            builder.scanInterval(Duration.ofSeconds(v));
        }
        if ((v = intValue(env, ENV_INPROCESS_MAX_ATTEMPTS)) != null) {
            builder.inProcessMaxAttempts(v);
        }
        if ((v = intValue(env, ENV_INPROCESS_BACKOFF_BASE_SECONDS)) != null) {
            builder.inProcessBackoffBase(Duration.ofSeconds(v));
        }
        if ((v = intValue(env, ENV_INPROCESS_BACKOFF_CAP_SECONDS)) != null) {
            builder.inProcessBackoffCap(Duration.ofSeconds(v));
        }
        String requeue = env.get(ENV_ENABLE_STARTUP_REQUEUE);
        if (requeue != null && !requeue.isBlank()) {
            builder.enableStartupRequeue(booleanValue(ENV_ENABLE_STARTUP_REQUEUE, requeue));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid pipeline configuration from environment: " + e.getMessage(), e);
        }
    }

    private static Integer intValue(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer but was '" + raw + "'", e);
        }
    }

    private static boolean booleanValue(String name, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(name + " must be a boolean but was '" + raw + "'");
        };
    }

    public int maxRetries(String collection) {
        Integer override = maxRetries.get(collection);
        if (override != null) {
            return override;
        }
        return TrackedCollections.byName(collection)
                .map(TrackedCollection::maxAttempts)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + collection));
    }

    /**
     * The standard tracked collections with configured attempt ceilings applied.
     */
    public List<TrackedCollection> collections() {
        List<TrackedCollection> out = new ArrayList<>();
        for (TrackedCollection collection : TrackedCollections.standard()) {
            out.add(collection.withMaxAttempts(maxRetries(collection.name())));
        }
        return List.copyOf(out);
    }

    public ExponentialBackoffRetryPolicy scannerBackoff() {
        return ExponentialBackoffRetryPolicy.scanner(retryBackoffBase, retryBackoffCap);
    }

    public ExponentialBackoffRetryPolicy inProcessRetryPolicy() {
        return ExponentialBackoffRetryPolicy.inProcess(inProcessBackoffBase, inProcessBackoffCap);
    }

    public Duration retryBackoffBase() {
        return retryBackoffBase;
    }

    public Duration retryBackoffCap() {
        return retryBackoffCap;
    }

    public Duration stuckThreshold() {
        return stuckThreshold;
    }

    public Duration scanInterval() {
        return scanInterval;
    }

    public int scanBatchSize() {
        return scanBatchSize;
    }

    public boolean enableStartupRequeue() {
        return enableStartupRequeue;
    }

    public int startupRequeueLimit() {
        return startupRequeueLimit;
    }

    public int inProcessMaxAttempts() {
        return inProcessMaxAttempts;
    }

    public Duration inProcessBackoffBase() {
        return inProcessBackoffBase;
    }

    public Duration inProcessBackoffCap() {
        return inProcessBackoffCap;
    }

    @Override
    public String toString() {
        return "PipelineConfig{maxRetries=" + maxRetries
                + ", retryBackoffBase=" + retryBackoffBase
                + ", retryBackoffCap=" + retryBackoffCap
                + ", stuckThreshold=" + stuckThreshold
                + ", scanInterval=" + scanInterval
                + ", scanBatchSize=" + scanBatchSize
                + ", enableStartupRequeue=" + enableStartupRequeue
                + ", inProcessMaxAttempts=" + inProcessMaxAttempts
                + ", inProcessBackoffBase=" + inProcessBackoffBase
                + ", inProcessBackoffCap=" + inProcessBackoffCap + '}';
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    /** Builder for {@link PipelineConfig}. */
    public static final class Builder {
        private final Map<String, Integer> maxRetries = new LinkedHashMap<>();
        private Duration retryBackoffBase = Duration.ofSeconds(300);
        private Duration retryBackoffCap = Duration.ofSeconds(3600);
        private Duration stuckThreshold = Duration.ofHours(24);
        private Duration scanInterval = Duration.ofSeconds(900);
        private int scanBatchSize = 500;
        private boolean enableStartupRequeue = true;
        private int startupRequeueLimit = 1000;
        private int inProcessMaxAttempts = 3;
        private Duration inProcessBackoffBase = Duration.ofSeconds(5);
        private Duration inProcessBackoffCap = Duration.ofSeconds(60);

        private Builder() {
        }

        /**
         * Overrides the scanner attempt ceiling of one collection.
         *
         * <p>Optional. Defaults to archives 3, messages 3, chunks 5, threads 5.
         */
        public Builder maxRetries(String collection, int maxAttempts) {
            Objects.requireNonNull(collection, "collection");
            if (TrackedCollections.byName(collection).isEmpty()) {
                throw new IllegalArgumentException("Unknown collection: " + collection);
            }
            maxRetries.put(collection, maxAttempts);
            return this;
        }

        /** <p>Optional. Defaults to 300 seconds. */
        public Builder retryBackoffBase(Duration retryBackoffBase) {
            this.retryBackoffBase = retryBackoffBase;
            return this;
        }

        /** <p>Optional. Defaults to 3600 seconds. */
        public Builder retryBackoffCap(Duration retryBackoffCap) {
            this.retryBackoffCap = retryBackoffCap;
            return this;
        }

        /** <p>Optional. Defaults to 24 hours. */
        public Builder stuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
            return this;
        }

        /** <p>Optional. Defaults to 900 seconds. */
        public Builder scanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
            return this;
        }

        /** <p>Optional. Defaults to {@code 500}. */
        public Builder scanBatchSize(int scanBatchSize) {
            this.scanBatchSize = scanBatchSize;
            return this;
        }

        /** <p>Optional. Defaults to {@code true}. */
        public Builder enableStartupRequeue(boolean enableStartupRequeue) {
            this.enableStartupRequeue = enableStartupRequeue;
            return this;
        }

        /** <p>Optional. Defaults to {@code 1000}. */
        public Builder startupRequeueLimit(int startupRequeueLimit) {
            this.startupRequeueLimit = startupRequeueLimit;
            return this;
        }

        /** <p>Optional. Defaults to {@code 3}. */
        public Builder inProcessMaxAttempts(int inProcessMaxAttempts) {
            this.inProcessMaxAttempts = inProcessMaxAttempts;
            return this;
        }

        /** <p>Optional. Defaults to 5 seconds. */
        public Builder inProcessBackoffBase(Duration inProcessBackoffBase) {
            this.inProcessBackoffBase = inProcessBackoffBase;
            return this;
        }

        /** <p>Optional. Defaults to 60 seconds. */
        public Builder inProcessBackoffCap(Duration inProcessBackoffCap) {
            this.inProcessBackoffCap = inProcessBackoffCap;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
