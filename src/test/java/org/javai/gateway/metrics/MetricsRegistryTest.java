package org.javai.gateway.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.gateway.MutableClock;
import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.DownstreamStatusException;
import org.javai.gateway.failure.Failure;
import org.javai.gateway.failure.TransientFailureClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsRegistryTest {

    private static final Map<String, String> CHURN_OK =
            Map.of("model_type", "churn", "operation", "predict", "status", "success");

    private MutableClock clock;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T08:00:00Z");
        metrics = new MetricsRegistry(new PerformanceTracker(Duration.ofMinutes(5), Duration.ofHours(1), clock));
    }

    @Test
    void increment_accumulatesPerLabelSet() {
        metrics.increment(GatewayMetric.REQUESTS, CHURN_OK);
        metrics.increment(GatewayMetric.REQUESTS, CHURN_OK, 2);
        metrics.increment(GatewayMetric.REQUESTS, Map.of("model_type", "churn", "operation", "predict", "status", "fallback"));

        assertThat(metrics.count(GatewayMetric.REQUESTS, CHURN_OK)).isEqualTo(3.0);
    }

    @Test
    void set_replacesGaugeValue() {
        Map<String, String> labels = Map.of("breaker", "prediction-service");
        assertThat(metrics.gaugeValue(GatewayMetric.CIRCUIT_BREAKER_STATE, labels)).isEmpty();

        metrics.set(GatewayMetric.CIRCUIT_BREAKER_STATE, labels, 1);
        metrics.set(GatewayMetric.CIRCUIT_BREAKER_STATE, labels, 2);

        assertThat(metrics.gaugeValue(GatewayMetric.CIRCUIT_BREAKER_STATE, labels)).contains(2.0);
    }

    @Test
    void observeDuration_countsObservations() {
        metrics.observeDuration(GatewayMetric.REQUEST_DURATION, CHURN_OK, 0.25);
        metrics.observeDuration(GatewayMetric.REQUEST_DURATION, CHURN_OK, 1.5);

        assertThat(metrics.observations(GatewayMetric.REQUEST_DURATION, CHURN_OK)).isEqualTo(2);
    }

    @Test
    void wrongLabelsOrKind_areRejected() {
        assertThatThrownBy(() -> metrics.increment(GatewayMetric.REQUESTS, Map.of("model_type", "churn")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects labels");
        assertThatThrownBy(() -> metrics.set(GatewayMetric.REQUESTS, CHURN_OK, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is a COUNTER");
        assertThatThrownBy(() -> metrics.increment(GatewayMetric.REQUESTS, CHURN_OK, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scrape_rendersPrometheusExposition() {
        metrics.increment(GatewayMetric.REQUESTS, CHURN_OK);
        metrics.observeDuration(GatewayMetric.REQUEST_DURATION, CHURN_OK, 0.3);
        metrics.set(GatewayMetric.CACHE_HIT_RATE, Map.of("cache", "responses"), 0.75);

        String exposition = metrics.scrape();

        assertThat(exposition)
                .contains("gateway_requests_total")
                .contains("model_type=\"churn\"")
                .contains("gateway_request_duration_seconds_bucket")
                .contains("gateway_cache_hit_rate");
    }

    @Test
    void summaryJson_includesMetersAndPerformance() throws Exception {
        metrics.increment(GatewayMetric.PREDICTIONS_SERVED, Map.of("model_type", "churn", "source", "live"));
        metrics.startRequest("r-1", Map.of());
        clock.advance(Duration.ofMillis(120));
        metrics.endRequest("r-1", RequestOutcome.SUCCESS);

        JsonNode summary = new ObjectMapper().readTree(metrics.summaryJson());

        assertThat(summary.path("metrics").isArray()).isTrue();
        assertThat(summary.path("metrics").findValuesAsText("name")).contains("gateway.predictions.served");
        assertThat(summary.path("performance").path("totalRequests").asInt()).isEqualTo(1);
        assertThat(summary.path("performance").path("avgDuration").asDouble()).isEqualTo(120.0);
        assertThat(summary.path("timestamp").asText()).isNotBlank();
    }

    @Test
    void reporter_countsRetriesFallbacksAndBreakerTransitions() {
        MetricsGatewayReporter reporter = new MetricsGatewayReporter(metrics);
        DownstreamStatusException error = new DownstreamStatusException(503, "Service Unavailable");
        Failure failure = Failure.of(new TransientFailureClassifier().classify("churn.predict", error),
                error, "churn.predict", "c-1", 1);

        reporter.reportRetryAttempt(failure, 1, Duration.ofSeconds(1), "standard");
        reporter.reportFallback(failure, "churn", "AI/ML service unavailable");
        reporter.reportBreakerTransition("prediction-service", BreakerState.CLOSED, BreakerState.OPEN);

        assertThat(metrics.count(GatewayMetric.RETRIES, Map.of("model_type", "churn", "reason", "http:503"))).isEqualTo(1.0);
        assertThat(metrics.count(GatewayMetric.FALLBACKS, Map.of("model_type", "churn", "reason", "http:503"))).isEqualTo(1.0);
        assertThat(metrics.gaugeValue(GatewayMetric.CIRCUIT_BREAKER_STATE, Map.of("breaker", "prediction-service")))
                .contains((double) BreakerState.OPEN.gaugeValue());
        assertThat(metrics.count(GatewayMetric.CIRCUIT_BREAKER_TRANSITIONS,
                Map.of("breaker", "prediction-service", "to_state", "open"))).isEqualTo(1.0);
    }

    @Test
    void modelTypeOf_stripsOperationAndBatchIndex() {
        assertThat(MetricsGatewayReporter.modelTypeOf("churn.predict[3]")).isEqualTo("churn");
        assertThat(MetricsGatewayReporter.modelTypeOf("standalone")).isEqualTo("standalone");
    }
}
