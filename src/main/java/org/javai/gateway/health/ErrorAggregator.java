package org.javai.gateway.health;

import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.FailureKind;
import org.javai.gateway.failure.TransientFailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Records every gateway failure with its context and derives health from the rolling error rate.
 *
 * <p>One instance per process, passed to whoever needs it. Records older than the retention
 * window (24 hours by default) are pruned on every write, on every read of the stats, and by
 * the optional periodic sweep. All state is guarded by the instance's monitor.
 */
public final class ErrorAggregator {

    private static final Logger log = LoggerFactory.getLogger(ErrorAggregator.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);
    static final String UNSPECIFIED = "unspecified";

    private final FailureClassifier classifier;
    private final Duration retention;
    private final Clock clock;

    private final Deque<ErrorRecord> window = new ArrayDeque<>();
    private final Map<String, Long> byType = new HashMap<>();
    private final Map<String, Long> byService = new HashMap<>();
    private final Map<String, Long> byEndpoint = new HashMap<>();
    private long total;
    private Instant lastErrorAt;

    public ErrorAggregator() {
        this(new TransientFailureClassifier(), DEFAULT_RETENTION, Clock.systemUTC());
    }

    public ErrorAggregator(FailureClassifier classifier, Duration retention, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
    }

    /**
     * Records an error.
     *
     * @return the stored record
     */
    public ErrorRecord record(Throwable error, ErrorContext context) {
        Objects.requireNonNull(error, "error must not be null");
        ErrorContext ctx = context == null ? ErrorContext.empty() : context;
        String operation = ctx.operation() != null ? ctx.operation() : UNSPECIFIED;
        FailureKind kind = classifier.classify(operation, error);

        ErrorRecord record = new ErrorRecord(
                UUID.randomUUID().toString(),
                clock.instant(),
                kind.failureClass().name(),
                kind.code().toString(),
                kind.message(),
                ctx);

        synchronized (this) {
            window.addLast(record);
            total++;
            increment(byType, record.errorType());
            increment(byService, ctx.service() != null ? ctx.service() : UNSPECIFIED);
            increment(byEndpoint, ctx.endpoint() != null ? ctx.endpoint() : UNSPECIFIED);
            lastErrorAt = record.timestamp();
            prune(record.timestamp());
        }

        log.debug("Recorded error {} [{}] on [{}] attempt {}/{} (correlationId={}): {}",
                record.id(), record.errorType(), operation, ctx.attempt(), ctx.maxRetries(),
                ctx.correlationId(), record.message());
        return record;
    }

    /**
     * @return a snapshot of the statistics, with the window pruned to the current time
     */
    public synchronized ErrorStats getStats() {
        prune(clock.instant());
        int windowCount = window.size();
        double rate = windowCount / (retention.toMillis() / 60_000.0);
        return new ErrorStats(total, byType, byService, byEndpoint, windowCount, rate,
                HealthStatus.forErrorRate(rate), lastErrorAt);
    }

    public HealthStatus healthStatus() {
        return getStats().healthStatus();
    }

    /**
     * @return the records inside the window, oldest first
     */
    public synchronized List<ErrorRecord> recentErrors() {
        prune(clock.instant());
        return List.copyOf(window);
    }

    /**
     * Classifies an error the same way retry policies do.
     */
    public boolean isRetryable(Throwable error) {
        return classifier.isRetryable(error);
    }

    /**
     * Drops records that have left the window.
     *
     * @return how many were dropped
     */
    public synchronized int sweep() {
        int before = window.size();
        prune(clock.instant());
        return before - window.size();
    }

    /**
     * Clears every counter and the window.
     */
    public synchronized void reset() {
        window.clear();
        byType.clear();
        byService.clear();
        byEndpoint.clear();
        total = 0;
        lastErrorAt = null;
    }

    /**
     * Schedules {@link #sweep()} at a fixed rate.
     *
     * @return the scheduled task, cancel it to stop sweeping
     */
    public ScheduledFuture<?> startSweeping(ScheduledExecutorService scheduler, Duration interval) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        return scheduler.scheduleAtFixedRate(() -> {
            int dropped = sweep();
            if (dropped > 0) {
                log.debug("Swept {} expired error records", dropped);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(retention);
        while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
            window.removeFirst();
        }
    }

    private static void increment(Map<String, Long> counts, String key) {
        counts.merge(key, 1L, Long::sum);
    }
}
