package org.javai.gateway.metrics;

import java.time.Instant;

/**
 * What the gateway has been doing over the trailing window, independent of the cumulative
 * registry.
 *
 * @param totalRequests requests completed inside the window
 * @param averageDurationMillis mean duration of those requests
 * @param errorCount those that did not succeed
 * @param errorRatePercent errorCount as a percentage of totalRequests
 * @param activeRequests requests started and not yet ended, at any age
 * @param p50Millis median duration
 * @param p90Millis 90th percentile duration
 * @param p95Millis 95th percentile duration
 * @param p99Millis 99th percentile duration
 * @param timestamp when the summary was computed
 */
public record PerformanceSummary(
        int totalRequests,
        double averageDurationMillis,
        int errorCount,
        double errorRatePercent,
        int activeRequests,
        double p50Millis,
        double p90Millis,
        double p95Millis,
        double p99Millis,
        Instant timestamp
) {
}
