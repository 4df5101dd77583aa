package org.javai.gateway.metrics;

import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.Failure;
import org.javai.gateway.ops.GatewayReporter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Turns gateway events into metric observations: retries, fallbacks and breaker transitions.
 * Plain failures are not counted here; the request counter already carries their outcome.
 */
public final class MetricsGatewayReporter implements GatewayReporter {

    private final MetricsRegistry metrics;

    public MetricsGatewayReporter(MetricsRegistry metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void report(Failure failure) {
        // counted by the request outcome
    }

    @Override
    public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyLabel) {
        metrics.increment(GatewayMetric.RETRIES,
                Map.of("model_type", modelTypeOf(failure.operation()), "reason", failure.code().toString()));
    }

    @Override
    public void reportFallback(Failure failure, String category, String reason) {
        metrics.increment(GatewayMetric.FALLBACKS, Map.of("model_type", category, "reason", failure.code().toString()));
    }

    @Override
    public void reportBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
        metrics.set(GatewayMetric.CIRCUIT_BREAKER_STATE, Map.of("breaker", breakerName), to.gaugeValue());
        metrics.increment(GatewayMetric.CIRCUIT_BREAKER_TRANSITIONS,
                Map.of("breaker", breakerName, "to_state", to.name().toLowerCase()));
    }

    /**
     * {@code churn.predict[3]} yields {@code churn}.
     */
    static String modelTypeOf(String operation) {
        int dot = operation.indexOf('.');
        return dot < 0 ? operation : operation.substring(0, dot);
    }
}
