package org.javai.gateway.metrics;

import org.javai.gateway.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PerformanceTrackerTest {

    private MutableClock clock;
    private PerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T08:00:00Z");
        tracker = new PerformanceTracker(Duration.ofMinutes(5), Duration.ofHours(1), clock);
    }

    @Test
    void summary_coversRequestsEndedInsideTheWindow() {
        for (int i = 1; i <= 10; i++) {
            String id = "r-" + i;
            tracker.startRequest(id, Map.of("model_type", "churn"));
            clock.advance(Duration.ofMillis(i * 100L));
            tracker.endRequest(id, i <= 2 ? RequestOutcome.FAILURE : RequestOutcome.SUCCESS);
        }

        PerformanceSummary summary = tracker.summary();

        assertThat(summary.totalRequests()).isEqualTo(10);
        assertThat(summary.errorCount()).isEqualTo(2);
        assertThat(summary.errorRatePercent()).isEqualTo(20.0);
        assertThat(summary.averageDurationMillis()).isEqualTo(550.0);
        assertThat(summary.p50Millis()).isEqualTo(500.0);
        assertThat(summary.p90Millis()).isEqualTo(900.0);
        assertThat(summary.p99Millis()).isEqualTo(1000.0);
        assertThat(summary.activeRequests()).isZero();
    }

    @Test
    void summary_excludesRequestsOlderThanTheWindow() {
        tracker.startRequest("old", Map.of());
        tracker.endRequest("old", RequestOutcome.SUCCESS);
        clock.advance(Duration.ofMinutes(6));

        assertThat(tracker.summary().totalRequests()).isZero();
    }

    @Test
    void endRequest_unknownId_isEmpty() {
        assertThat(tracker.endRequest("never-started", RequestOutcome.SUCCESS)).isEmpty();
    }

    @Test
    void fallback_countsAsError() {
        tracker.startRequest("r", Map.of());
        tracker.endRequest("r", RequestOutcome.FALLBACK);

        assertThat(tracker.summary().errorCount()).isEqualTo(1);
    }

    @Test
    void cleanup_dropsRequestsThatNeverEnded() {
        tracker.startRequest("stuck", Map.of());
        clock.advance(Duration.ofMinutes(30));
        tracker.startRequest("recent", Map.of());
        clock.advance(Duration.ofMinutes(31));

        int dropped = tracker.cleanup();

        assertThat(dropped).isEqualTo(1);
        assertThat(tracker.activeRequests()).isEqualTo(1);
        assertThat(tracker.endRequest("stuck", RequestOutcome.SUCCESS)).isEmpty();
    }

    @Test
    void constructor_rejectsStaleAgeShorterThanWindow() {
        assertThatThrownBy(() -> new PerformanceTracker(Duration.ofMinutes(5), Duration.ofMinutes(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
