package org.javai.gateway.health;

import org.javai.gateway.MutableClock;
import org.javai.gateway.failure.DownstreamStatusException;
import org.javai.gateway.failure.TransientFailureClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ErrorAggregatorTest {

    private MutableClock clock;
    private ErrorAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-02-10T00:00:00Z");
        aggregator = new ErrorAggregator(new TransientFailureClassifier(), Duration.ofHours(24), clock);
    }

    @Test
    void healthStatus_followsTheRateThresholds() {
        record(143);
        assertThat(aggregator.healthStatus()).isEqualTo(HealthStatus.HEALTHY);

        record(1);
        assertThat(aggregator.healthStatus()).isEqualTo(HealthStatus.WARNING);

        record(575);
        assertThat(aggregator.healthStatus()).isEqualTo(HealthStatus.WARNING);

        record(1);
        assertThat(aggregator.healthStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(aggregator.getStats().errorRatePerMinute()).isEqualTo(0.5);
    }

    @Test
    void errorsLeaveTheWindowAfterRetention() {
        record(720);
        assertThat(aggregator.healthStatus()).isEqualTo(HealthStatus.CRITICAL);

        clock.advance(Duration.ofHours(24).plusSeconds(1));

        ErrorStats stats = aggregator.getStats();
        assertThat(stats.windowCount()).isZero();
        assertThat(stats.healthStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(stats.total()).isEqualTo(720);
    }

    @Test
    void sweep_dropsExpiredRecords() {
        record(3);
        clock.advance(Duration.ofHours(12));
        record(2);
        clock.advance(Duration.ofHours(13));

        assertThat(aggregator.sweep()).isEqualTo(3);
        assertThat(aggregator.recentErrors()).hasSize(2);
    }

    @Test
    void record_countsByClassServiceAndEndpoint() {
        aggregator.record(new DownstreamStatusException(503, "Service Unavailable"), ErrorContext.builder()
                .service("prediction-service")
                .endpoint("/api/churn/predict")
                .operation("churn.predict")
                .correlationId("c-1")
                .attempt(2, 3)
                .build());
        aggregator.record(new ConnectException("refused"), null);

        ErrorStats stats = aggregator.getStats();

        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.byType()).containsEntry("DOWNSTREAM_SERVER", 1L).containsEntry("TRANSIENT_NETWORK", 1L);
        assertThat(stats.byService()).containsEntry("prediction-service", 1L).containsEntry("unspecified", 1L);
        assertThat(stats.byEndpoint()).containsEntry("/api/churn/predict", 1L);
        assertThat(stats.lastErrorAt()).isEqualTo(clock.instant());
        assertThat(aggregator.recentErrors().get(0).code()).isEqualTo("http:503");
        assertThat(aggregator.recentErrors().get(0).context().attempt()).isEqualTo(2);
    }

    @Test
    void isRetryable_delegatesToTheClassifier() {
        assertThat(aggregator.isRetryable(new DownstreamStatusException(502, "Bad Gateway"))).isTrue();
        assertThat(aggregator.isRetryable(new DownstreamStatusException(401, "Unauthorized"))).isFalse();
    }

    @Test
    void reset_clearsEverything() {
        record(10);

        aggregator.reset();

        ErrorStats stats = aggregator.getStats();
        assertThat(stats.total()).isZero();
        assertThat(stats.byType()).isEmpty();
        assertThat(stats.lastErrorAt()).isNull();
    }

    @Test
    void errorContext_redactsSensitiveDetails() {
        ErrorContext context = ErrorContext.builder()
                .details(Map.of(
                        "Authorization", "Bearer abc",
                        "x-api-key", "k-123",
                        "client_secret", "s",
                        "organizationId", "org-7"))
                .build();

        assertThat(context.details())
                .containsEntry("Authorization", ErrorContext.REDACTED)
                .containsEntry("x-api-key", ErrorContext.REDACTED)
                .containsEntry("client_secret", ErrorContext.REDACTED)
                .containsEntry("organizationId", "org-7");
    }

    @Test
    void atLeast_picksTheWorseStatus() {
        assertThat(HealthStatus.HEALTHY.atLeast(HealthStatus.WARNING)).isEqualTo(HealthStatus.WARNING);
        assertThat(HealthStatus.CRITICAL.atLeast(HealthStatus.WARNING)).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    void subMinuteRetention_computesAFiniteRate() {
        ErrorAggregator shortWindow = new ErrorAggregator(new TransientFailureClassifier(), Duration.ofSeconds(30), clock);
        assertThat(shortWindow.getStats().errorRatePerMinute()).isZero();
        assertThat(shortWindow.healthStatus()).isEqualTo(HealthStatus.HEALTHY);

        shortWindow.record(new ConnectException("refused"), ErrorContext.empty());

        assertThat(shortWindow.getStats().errorRatePerMinute()).isEqualTo(2.0);
        assertThat(shortWindow.healthStatus()).isEqualTo(HealthStatus.CRITICAL);
    }

    private void record(int count) {
        for (int i = 0; i < count; i++) {
            aggregator.record(new ConnectException("refused"), ErrorContext.empty());
        }
    }
}
