package org.javai.gateway.config;

import org.javai.gateway.breaker.CircuitBreakerConfig;
import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.health.HealthMonitorConfig;
import org.javai.gateway.retry.BatchOptions;
import org.javai.gateway.retry.RetryPolicy;
import org.javai.gateway.ops.ConfigResolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of one {@code PredictionGateway}.
 *
 * <p>{@link #load()} starts from the classpath defaults in {@value #RESOURCE} and lets each key be
 * overridden by a system property of the same name or by an environment variable, for example
 * {@code GATEWAY_RETRY_MAX_RETRIES} for {@code gateway.retry.max-retries}. A timeout of zero
 * means none.
 */
public record GatewayConfig(
        String targetName,
        int maxRetries,
        Duration baseDelay,
        double backoffFactor,
        Duration maxDelay,
        Duration attemptTimeout,
        Duration overallTimeout,
        int breakerFailureThreshold,
        Duration breakerFailureWindow,
        Duration breakerOpenDuration,
        int batchConcurrency,
        boolean cacheEnabled,
        long cacheMaxSize,
        Duration cacheTtl,
        boolean refreshFallbackOnSuccess,
        Duration errorRetention,
        Duration errorSweepInterval,
        Duration performanceWindow,
        Duration metricsCleanupInterval,
        Duration staleRequestAge,
        HealthMonitorConfig healthMonitor
) {

    public static final String RESOURCE = "resilient-gateway.properties";

    public GatewayConfig {
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        Objects.requireNonNull(breakerFailureWindow, "breakerFailureWindow must not be null");
        Objects.requireNonNull(breakerOpenDuration, "breakerOpenDuration must not be null");
        Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        Objects.requireNonNull(errorRetention, "errorRetention must not be null");
        Objects.requireNonNull(errorSweepInterval, "errorSweepInterval must not be null");
        Objects.requireNonNull(performanceWindow, "performanceWindow must not be null");
        Objects.requireNonNull(metricsCleanupInterval, "metricsCleanupInterval must not be null");
        Objects.requireNonNull(staleRequestAge, "staleRequestAge must not be null");
        Objects.requireNonNull(healthMonitor, "healthMonitor must not be null");
        if (targetName.isBlank()) {
            throw new IllegalArgumentException("targetName must not be blank");
        }
        if (batchConcurrency < 1) {
            throw new IllegalArgumentException("batchConcurrency must be >= 1, was: " + batchConcurrency);
        }
    }

    /**
     * Reads the classpath defaults with system property and environment overrides applied.
     *
     * @throws IllegalStateException if a value is missing or malformed
     */
    public static GatewayConfig load() {
        return from(new ConfigResolver(classpathDefaults()));
    }

    /**
     * Reads every setting through the given resolver.
     */
    public static GatewayConfig from(ConfigResolver config) {
        return new GatewayConfig(
                config.require("gateway.target-name"),
                config.requireInt("gateway.retry.max-retries"),
                millis(config, "gateway.retry.base-delay-ms"),
                config.requireDouble("gateway.retry.backoff-factor"),
                millis(config, "gateway.retry.max-delay-ms"),
                optionalMillis(config, "gateway.retry.attempt-timeout-ms"),
                optionalMillis(config, "gateway.retry.overall-timeout-ms"),
                config.requireInt("gateway.breaker.failure-threshold"),
                millis(config, "gateway.breaker.failure-window-ms"),
                millis(config, "gateway.breaker.open-duration-ms"),
                config.requireInt("gateway.batch.concurrency"),
                config.requireBoolean("gateway.cache.enabled"),
                config.requireLong("gateway.cache.max-size"),
                millis(config, "gateway.cache.ttl-ms"),
                config.requireBoolean("gateway.fallback.refresh-on-success"),
                millis(config, "gateway.errors.retention-ms"),
                millis(config, "gateway.errors.sweep-interval-ms"),
                millis(config, "gateway.metrics.performance-window-ms"),
                millis(config, "gateway.metrics.cleanup-interval-ms"),
                millis(config, "gateway.metrics.stale-request-age-ms"),
                healthMonitor(config));
    }

    static Properties classpathDefaults() {
        Properties properties = new Properties();
        try (InputStream in = GatewayConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Classpath resource " + RESOURCE + " not found");
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return properties;
    }

    /**
     * The policy applied to every downstream call unless the caller overrides it.
     */
    public RetryPolicy retryPolicy(FailureClassifier classifier) {
        return RetryPolicy.builder(RetryPolicy.EXTERNAL_SERVICE_DEFAULT)
                .maxRetries(maxRetries)
                .baseDelay(baseDelay)
                .backoffFactor(backoffFactor)
                .maxDelay(maxDelay)
                .classifier(classifier)
                .attemptTimeout(attemptTimeout)
                .overallTimeout(overallTimeout)
                .build();
    }

    public CircuitBreakerConfig breakerConfig(FailureClassifier classifier) {
        return new CircuitBreakerConfig(breakerFailureThreshold, breakerFailureWindow, breakerOpenDuration,
                CircuitBreakerConfig.countedFailures(classifier));
    }

    /**
     * Batch items are independent predictions, so a failed item never aborts the rest.
     */
    public BatchOptions batchOptions() {
        return BatchOptions.of(batchConcurrency, false);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static HealthMonitorConfig healthMonitor(ConfigResolver config) {
        return new HealthMonitorConfig(
                config.requireBoolean("gateway.health.monitor.enabled"),
                millis(config, "gateway.health.check-interval-ms"),
                millis(config, "gateway.health.check-timeout-ms"),
                config.requireInt("gateway.health.check-retries"),
                millis(config, "gateway.health.check-retry-delay-ms"),
                config.requireInt("gateway.health.unhealthy-threshold"),
                config.requireInt("gateway.health.recovery-threshold"),
                config.requireInt("gateway.health.history-size"));
    }

    private static Duration millis(ConfigResolver config, String key) {
        long value = config.requireLong(key);
        if (value < 0) {
            throw new IllegalStateException("Configuration '" + key + "' must not be negative, was: " + value);
        }
        return Duration.ofMillis(value);
    }

    private static Duration optionalMillis(ConfigResolver config, String key) {
        Duration value = millis(config, key);
        return value.isZero() ? null : value;
    }

    /**
     * Adjusts a loaded configuration, typically in tests.
     */
    public static final class Builder {
        private String targetName;
        private int maxRetries;
        private Duration baseDelay;
        private double backoffFactor;
        private Duration maxDelay;
        private Duration attemptTimeout;
        private Duration overallTimeout;
        private int breakerFailureThreshold;
        private Duration breakerFailureWindow;
        private Duration breakerOpenDuration;
        private int batchConcurrency;
        private boolean cacheEnabled;
        private long cacheMaxSize;
        private Duration cacheTtl;
        private boolean refreshFallbackOnSuccess;
        private Duration errorRetention;
        private Duration errorSweepInterval;
        private Duration performanceWindow;
        private Duration metricsCleanupInterval;
        private Duration staleRequestAge;
        private HealthMonitorConfig healthMonitor;

        private Builder(GatewayConfig base) {
            this.targetName = base.targetName;
            this.maxRetries = base.maxRetries;
            this.baseDelay = base.baseDelay;
            this.backoffFactor = base.backoffFactor;
            this.maxDelay = base.maxDelay;
            this.attemptTimeout = base.attemptTimeout;
            this.overallTimeout = base.overallTimeout;
            this.breakerFailureThreshold = base.breakerFailureThreshold;
            this.breakerFailureWindow = base.breakerFailureWindow;
            this.breakerOpenDuration = base.breakerOpenDuration;
            this.batchConcurrency = base.batchConcurrency;
            this.cacheEnabled = base.cacheEnabled;
            this.cacheMaxSize = base.cacheMaxSize;
            this.cacheTtl = base.cacheTtl;
            this.refreshFallbackOnSuccess = base.refreshFallbackOnSuccess;
            this.errorRetention = base.errorRetention;
            this.errorSweepInterval = base.errorSweepInterval;
            this.performanceWindow = base.performanceWindow;
            this.metricsCleanupInterval = base.metricsCleanupInterval;
            this.staleRequestAge = base.staleRequestAge;
            this.healthMonitor = base.healthMonitor;
        }

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder retries(int maxRetries, Duration baseDelay, double backoffFactor, Duration maxDelay) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.backoffFactor = backoffFactor;
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * @param attemptTimeout per attempt, or null for none
         * @param overallTimeout across all attempts, or null for none
         */
        public Builder timeouts(Duration attemptTimeout, Duration overallTimeout) {
            this.attemptTimeout = attemptTimeout;
            this.overallTimeout = overallTimeout;
            return this;
        }

        public Builder breaker(int failureThreshold, Duration failureWindow, Duration openDuration) {
            this.breakerFailureThreshold = failureThreshold;
            this.breakerFailureWindow = failureWindow;
            this.breakerOpenDuration = openDuration;
            return this;
        }

        public Builder batchConcurrency(int batchConcurrency) {
            this.batchConcurrency = batchConcurrency;
            return this;
        }

        public Builder cache(boolean enabled, long maxSize, Duration ttl) {
            this.cacheEnabled = enabled;
            this.cacheMaxSize = maxSize;
            this.cacheTtl = ttl;
            return this;
        }

        public Builder refreshFallbackOnSuccess(boolean refresh) {
            this.refreshFallbackOnSuccess = refresh;
            return this;
        }

        public Builder errorRetention(Duration retention) {
            this.errorRetention = retention;
            return this;
        }

        public Builder performanceWindow(Duration window) {
            this.performanceWindow = window;
            return this;
        }

        public Builder healthMonitor(HealthMonitorConfig healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(targetName, maxRetries, baseDelay, backoffFactor, maxDelay, attemptTimeout,
                    overallTimeout, breakerFailureThreshold, breakerFailureWindow, breakerOpenDuration,
                    batchConcurrency, cacheEnabled, cacheMaxSize, cacheTtl, refreshFallbackOnSuccess,
                    errorRetention, errorSweepInterval, performanceWindow, metricsCleanupInterval, staleRequestAge,
                    healthMonitor);
        }
    }
}
