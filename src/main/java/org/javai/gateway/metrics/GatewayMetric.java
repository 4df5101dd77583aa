package org.javai.gateway.metrics;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * The closed set of metrics the gateway records. Each metric has one kind and a fixed set of
 * label names; the registry rejects observations that do not match.
 *
 * <p>Names are Micrometer names; the Prometheus exposition renders {@code gateway.requests} as
 * {@code gateway_requests_total} and {@code gateway.request.duration} as
 * {@code gateway_request_duration_seconds}.
 */
public enum GatewayMetric {

    REQUEST_DURATION("gateway.request.duration", MetricKind.HISTOGRAM,
            "Duration of downstream prediction requests", "model_type", "operation", "status"),
    REQUESTS("gateway.requests", MetricKind.COUNTER,
            "Downstream prediction requests", "model_type", "operation", "status"),
    RETRIES("gateway.retries", MetricKind.COUNTER,
            "Retries scheduled", "model_type", "reason"),
    FALLBACKS("gateway.fallbacks", MetricKind.COUNTER,
            "Fallback entries served", "model_type", "reason"),
    CACHE_OPERATIONS("gateway.cache.operations", MetricKind.COUNTER,
            "Response cache operations", "operation", "result"),
    CACHE_HIT_RATE("gateway.cache.hit.rate", MetricKind.GAUGE,
            "Response cache hit rate", "cache"),
    PREDICTIONS_SERVED("gateway.predictions.served", MetricKind.COUNTER,
            "Predictions returned to callers", "model_type", "source"),
    BATCH_JOBS("gateway.batch.jobs", MetricKind.COUNTER,
            "Batch invocations", "job_type", "status"),
    ERROR_RATE("gateway.error.rate", MetricKind.GAUGE,
            "Errors per minute over the rolling window", "service"),
    CIRCUIT_BREAKER_STATE("gateway.circuit.breaker.state", MetricKind.GAUGE,
            "Circuit breaker state (0 closed, 1 open, 2 half-open)", "breaker"),
    CIRCUIT_BREAKER_TRANSITIONS("gateway.circuit.breaker.transitions", MetricKind.COUNTER,
            "Circuit breaker state changes", "breaker", "to_state");

    static final List<Duration> DURATION_BUCKETS = List.of(
            Duration.ofMillis(100), Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofSeconds(2),
            Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(30));

    private final String metricName;
    private final MetricKind kind;
    private final String description;
    private final Set<String> labelNames;

    GatewayMetric(String metricName, MetricKind kind, String description, String... labelNames) {
        this.metricName = metricName;
        this.kind = kind;
        this.description = description;
        this.labelNames = Set.of(labelNames);
    }

    public String metricName() {
        return metricName;
    }

    public MetricKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public Set<String> labelNames() {
        return labelNames;
    }
}
