package org.javai.gateway.health;

/**
 * Health checks over a trailing window.
 *
 * @param successRate successful checks in percent, 0 when there were none
 * @param averageResponseMillis mean duration of the successful checks, 0 when there were none
 * @param direction how the second half of the window compares to the first
 */
public record HealthTrend(
        int totalChecks,
        int successfulChecks,
        int failedChecks,
        double successRate,
        double averageResponseMillis,
        Direction direction
) {

    public enum Direction {
        IMPROVING,
        STABLE,
        DEGRADING,
        UNKNOWN
    }

    static HealthTrend empty() {
        return new HealthTrend(0, 0, 0, 0, 0, Direction.UNKNOWN);
    }
}
