package org.javai.gateway.health;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a {@link HealthMonitor}.
 *
 * @param lastCheckAt end of the most recent check, or null before the first one
 * @param lastCheckDuration duration of the most recent check, or null before the first one
 * @param successRate successful checks over all checks in percent, 0 before the first one
 * @param averageResponseMillis mean duration of all checks
 * @param uptime time spent UP, including the current stretch
 * @param currentDowntime length of the current DOWN stretch, zero otherwise
 * @param lastDowntime length of the most recent completed DOWN stretch, or null
 * @param recentChecks up to the last ten checks, oldest first
 */
public record ServiceHealth(
        ServiceState state,
        boolean monitoring,
        Instant lastCheckAt,
        Duration lastCheckDuration,
        int consecutiveFailures,
        int consecutiveSuccesses,
        long totalChecks,
        long successfulChecks,
        long failedChecks,
        double successRate,
        double averageResponseMillis,
        Duration uptime,
        Duration currentDowntime,
        Duration lastDowntime,
        List<HealthCheck> recentChecks
) {

    public ServiceHealth {
        recentChecks = List.copyOf(recentChecks);
    }

    public boolean isUp() {
        return state == ServiceState.UP;
    }
}
