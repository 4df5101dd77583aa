package org.javai.gateway.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Short-window request tracking behind {@link MetricsRegistry#performanceSummary()}.
 *
 * <p>{@link #startRequest} and {@link #endRequest} bracket one unit of work. Completed requests
 * are kept as samples; {@link #cleanup()} drops samples and unmatched starts older than the
 * stale age, so a start whose end never arrives cannot leak.
 */
public final class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
    public static final Duration DEFAULT_STALE_AGE = Duration.ofHours(1);

    private record InFlight(Instant startedAt, Map<String, String> metadata) {}

    private record Sample(Instant completedAt, long durationMillis, boolean error) {}

    private final Duration window;
    private final Duration staleAge;
    private final Clock clock;
    private final ConcurrentMap<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Deque<Sample> samples = new ArrayDeque<>();

    public PerformanceTracker() {
        this(DEFAULT_WINDOW, DEFAULT_STALE_AGE, Clock.systemUTC());
    }

    public PerformanceTracker(Duration window, Duration staleAge, Clock clock) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.staleAge = Objects.requireNonNull(staleAge, "staleAge must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (staleAge.compareTo(window) < 0) {
            throw new IllegalArgumentException("staleAge must be >= window");
        }
    }

    public void startRequest(String id, Map<String, String> metadata) {
        Objects.requireNonNull(id, "id must not be null");
        inFlight.put(id, new InFlight(clock.instant(), metadata == null ? Map.of() : Map.copyOf(metadata)));
    }

    /**
     * Ends a request.
     *
     * @return its duration, or empty if the id was never started or was already cleaned up
     */
    public Optional<Duration> endRequest(String id, RequestOutcome outcome) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        InFlight started = inFlight.remove(id);
        if (started == null) {
            log.debug("endRequest for unknown request {}", id);
            return Optional.empty();
        }
        Instant now = clock.instant();
        Duration duration = Duration.between(started.startedAt(), now);
        synchronized (samples) {
            samples.addLast(new Sample(now, duration.toMillis(), outcome.isError()));
            pruneSamples(now.minus(staleAge));
        }
        return Optional.of(duration);
    }

    public int activeRequests() {
        return inFlight.size();
    }

    public PerformanceSummary summary() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        long[] durations;
        int errors = 0;
        synchronized (samples) {
            durations = samples.stream()
                    .filter(s -> !s.completedAt().isBefore(cutoff))
                    .mapToLong(Sample::durationMillis)
                    .toArray();
            for (Sample sample : samples) {
                if (sample.error() && !sample.completedAt().isBefore(cutoff)) {
                    errors++;
                }
            }
        }
        int total = durations.length;
        double average = total == 0 ? 0.0 : Arrays.stream(durations).average().orElse(0.0);
        double errorRate = total == 0 ? 0.0 : errors * 100.0 / total;
        Arrays.sort(durations);
        return new PerformanceSummary(total, average, errors, errorRate, inFlight.size(),
                percentile(durations, 0.50), percentile(durations, 0.90),
                percentile(durations, 0.95), percentile(durations, 0.99), now);
    }

    /**
     * Drops samples and unmatched starts older than the stale age.
     *
     * @return how many unmatched starts were dropped
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(staleAge);
        int before = inFlight.size();
        inFlight.entrySet().removeIf(entry -> entry.getValue().startedAt().isBefore(cutoff));
        int dropped = before - inFlight.size();
        synchronized (samples) {
            pruneSamples(cutoff);
        }
        if (dropped > 0) {
            log.info("Dropped {} requests that never ended", dropped);
        }
        return dropped;
    }

    private void pruneSamples(Instant cutoff) {
        while (!samples.isEmpty() && samples.peekFirst().completedAt().isBefore(cutoff)) {
            samples.removeFirst();
        }
    }

    private static double percentile(long[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = (int) Math.ceil(quantile * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }
}
