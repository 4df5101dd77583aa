package org.javai.gateway.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a {@link HealthMonitor}.
 *
 * @param enabled whether the gateway starts periodic checks on its own
 * @param checkInterval pause between the end of one check and the start of the next
 * @param timeout timeout of each endpoint call
 * @param retries extra endpoint calls within one check before it counts as failed
 * @param retryDelay pause between endpoint calls within one check
 * @param unhealthyThreshold consecutive failed checks that mark the service down
 * @param recoveryThreshold consecutive successful checks that mark the service up
 * @param historySize number of checks kept for status and trends
 */
public record HealthMonitorConfig(
        boolean enabled,
        Duration checkInterval,
        Duration timeout,
        int retries,
        Duration retryDelay,
        int unhealthyThreshold,
        int recoveryThreshold,
        int historySize
) {

    public HealthMonitorConfig {
        Objects.requireNonNull(checkInterval, "checkInterval must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("checkInterval must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, was: " + retries);
        }
        if (unhealthyThreshold < 1 || recoveryThreshold < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, was: " + historySize);
        }
    }

    /**
     * Checks every 30 s with a 5 s timeout and two retries a second apart; three failures mark the
     * service down and two successes bring it back. Not started automatically.
     */
    public static HealthMonitorConfig defaults() {
        return new HealthMonitorConfig(false, Duration.ofSeconds(30), Duration.ofSeconds(5), 2,
                Duration.ofSeconds(1), 3, 2, 100);
    }

    public HealthMonitorConfig withEnabled(boolean enabled) {
        return new HealthMonitorConfig(enabled, checkInterval, timeout, retries, retryDelay,
                unhealthyThreshold, recoveryThreshold, historySize);
    }
}
