package org.javai.gateway.health;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate error statistics. The by-type, by-service and by-endpoint maps are cumulative since
 * start or the last reset; {@code windowCount} and the rate only cover the rolling window.
 *
 * @param total errors recorded since start or the last reset
 * @param byType counts per failure class
 * @param byService counts per service
 * @param byEndpoint counts per endpoint
 * @param windowCount errors inside the rolling window
 * @param errorRatePerMinute {@code windowCount} divided by the window length in minutes
 * @param healthStatus status derived from the rate
 * @param lastErrorAt time of the most recent error, or null
 */
public record ErrorStats(
        long total,
        Map<String, Long> byType,
        Map<String, Long> byService,
        Map<String, Long> byEndpoint,
        int windowCount,
        double errorRatePerMinute,
        HealthStatus healthStatus,
        Instant lastErrorAt
) {

    public ErrorStats {
        byType = Map.copyOf(byType);
        byService = Map.copyOf(byService);
        byEndpoint = Map.copyOf(byEndpoint);
    }
}
