package org.javai.gateway.health;

/**
 * Health derived from the rolling error rate.
 */
public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    static final double WARNING_RATE_PER_MINUTE = 0.1;
    static final double CRITICAL_RATE_PER_MINUTE = 0.5;

    /**
     * Below 0.1 errors per minute is healthy, below 0.5 a warning, anything else critical.
     */
    public static HealthStatus forErrorRate(double errorsPerMinute) {
        if (errorsPerMinute < WARNING_RATE_PER_MINUTE) {
            return HEALTHY;
        }
        if (errorsPerMinute < CRITICAL_RATE_PER_MINUTE) {
            return WARNING;
        }
        return CRITICAL;
    }

    /**
     * @return the worse of the two statuses
     */
    public HealthStatus atLeast(HealthStatus other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
