package org.javai.gateway.breaker;

import java.time.Instant;

/**
 * A point-in-time view of a {@link CircuitBreaker}, exposed on the health surface.
 *
 * @param name the breaker's target name
 * @param state current state
 * @param consecutiveFailures counted failures since the last success
 * @param openedAt when the breaker last opened, or null if it never has since the last close
 * @param halfOpenProbeInFlight whether the single half-open probe is currently running
 * @param totalRequests calls offered to the breaker, rejected ones included
 * @param successes calls that succeeded
 * @param failures counted failures
 * @param rejections calls rejected without reaching downstream
 * @param averageResponseTimeMillis mean duration of calls that reached downstream
 */
public record CircuitBreakerState(
        String name,
        BreakerState state,
        int consecutiveFailures,
        Instant openedAt,
        boolean halfOpenProbeInFlight,
        long totalRequests,
        long successes,
        long failures,
        long rejections,
        double averageResponseTimeMillis
) {

    /**
     * @return failures as a share of calls that reached downstream, 0 when none did
     */
    public double failureRate() {
        long completed = successes + failures;
        return completed == 0 ? 0.0 : (double) failures / completed;
    }
}
