package org.javai.gateway.health;

import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.retry.RetryExecutor;
import org.javai.gateway.retry.RetryPolicy;
import org.javai.gateway.retry.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Actively checks the downstream service and keeps a verdict on whether it is up.
 *
 * <p>Each check calls the {@link HealthEndpoint} up to {@code retries + 1} times. The service is
 * marked {@link ServiceState#DOWN} after {@code unhealthyThreshold} failed checks in a row and
 * {@link ServiceState#UP} after {@code recoveryThreshold} successful ones; until either happens it
 * is {@link ServiceState#UNKNOWN}. Periodic checks never overlap: the next one is scheduled when
 * the previous one has finished.
 */
public final class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private static final int RECENT_CHECKS = 10;
    private static final double TREND_MARGIN = 0.1;

    private final String target;
    private final HealthEndpoint endpoint;
    private final HealthMonitorConfig config;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final RetryExecutor executor;
    private final RetryPolicy checkPolicy;

    // All mutable state below is guarded by this
    private final Deque<HealthCheck> history = new ArrayDeque<>();
    private ServiceState state = ServiceState.UNKNOWN;
    private boolean monitoring;
    private ScheduledFuture<?> nextCheck;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long totalChecks;
    private long successfulChecks;
    private long failedChecks;
    private double averageResponseMillis;
    private Duration accumulatedUptime = Duration.ZERO;
    private Instant upSince;
    private Instant downSince;
    private Duration lastDowntime;
    private HealthCheck lastCheck;

    public HealthMonitor(String target, HealthEndpoint endpoint, HealthMonitorConfig config,
                         ScheduledExecutorService scheduler, Clock clock) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = RetryExecutor.builder().scheduler(scheduler).clock(clock).build();
        this.checkPolicy = RetryPolicy.builder("health-check")
                .maxRetries(config.retries())
                .baseDelay(config.retryDelay())
                .maxDelay(config.retryDelay())
                .retryOn(error -> true)
                .attemptTimeout(config.timeout())
                .build();
    }

    /**
     * Starts periodic checks, the first one right away.
     *
     * @return false if monitoring was already running
     */
    public synchronized boolean start() {
        if (monitoring) {
            log.warn("Health monitoring of [{}] is already running", target);
            return false;
        }
        monitoring = true;
        log.info("Starting health monitoring of [{}] every {}ms", target, config.checkInterval().toMillis());
        scheduleNext(Duration.ZERO);
        return true;
    }

    /**
     * Stops periodic checks. A check already in flight still completes and is recorded.
     *
     * @return false if monitoring was not running
     */
    public synchronized boolean stop() {
        if (!monitoring) {
            return false;
        }
        monitoring = false;
        if (nextCheck != null) {
            nextCheck.cancel(false);
            nextCheck = null;
        }
        log.info("Stopped health monitoring of [{}]", target);
        return true;
    }

    public synchronized boolean isMonitoring() {
        return monitoring;
    }

    /**
     * Runs one check outside the schedule and returns the resulting status.
     */
    public CompletableFuture<ServiceHealth> forceCheck() {
        log.info("Forcing a health check of [{}]", target);
        return check().thenApply(ignored -> status());
    }

    /**
     * Runs one check. The future never fails; a failed check is a {@link HealthCheck} too.
     */
    public CompletableFuture<HealthCheck> check() {
        Instant startedAt = clock.instant();
        return executor.run(this::callEndpoint, checkPolicy, RunContext.of("health-check[" + target + "]"))
                .handle((ignored, error) -> record(startedAt, error == null ? null : FailureClassifier.unwrap(error)));
    }

    private CompletableFuture<Boolean> callEndpoint() {
        return endpoint.check().toCompletableFuture().thenApply(response -> {
            if (response == null) {
                throw new IllegalStateException("Health endpoint returned no body");
            }
            return Boolean.TRUE;
        });
    }

    private synchronized void scheduleNext(Duration delay) {
        if (!monitoring) {
            return;
        }
        try {
            nextCheck = scheduler.schedule(this::periodicCheck, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Health monitoring of [{}] stopped: scheduler no longer accepts tasks", target);
            monitoring = false;
        }
    }

    private void periodicCheck() {
        check().whenComplete((ignored, error) -> scheduleNext(config.checkInterval()));
    }

    private synchronized HealthCheck record(Instant startedAt, Throwable error) {
        Instant now = clock.instant();
        Duration duration = Duration.between(startedAt, now);
        HealthCheck check = new HealthCheck(now, error == null, duration, error == null ? null : describe(error));
        history.addLast(check);
        while (history.size() > config.historySize()) {
            history.removeFirst();
        }
        lastCheck = check;
        totalChecks++;
        averageResponseMillis += (duration.toMillis() - averageResponseMillis) / totalChecks;

        if (check.success()) {
            successfulChecks++;
            consecutiveFailures = 0;
            consecutiveSuccesses++;
            log.debug("Health check of [{}] succeeded in {}ms ({} in a row)",
                    target, duration.toMillis(), consecutiveSuccesses);
            if (state != ServiceState.UP && consecutiveSuccesses >= config.recoveryThreshold()) {
                markUp(now);
            }
        } else {
            failedChecks++;
            consecutiveSuccesses = 0;
            consecutiveFailures++;
            log.warn("Health check of [{}] failed after {}ms ({} in a row): {}",
                    target, duration.toMillis(), consecutiveFailures, check.error());
            if (state != ServiceState.DOWN && consecutiveFailures >= config.unhealthyThreshold()) {
                markDown(now);
            }
        }
        return check;
    }

    private void markUp(Instant now) {
        if (downSince != null) {
            lastDowntime = Duration.between(downSince, now);
            downSince = null;
        }
        upSince = now;
        state = ServiceState.UP;
        log.info("Service [{}] marked UP after {} successful checks", target, consecutiveSuccesses);
    }

    private void markDown(Instant now) {
        if (upSince != null) {
            accumulatedUptime = accumulatedUptime.plus(Duration.between(upSince, now));
            upSince = null;
        }
        downSince = now;
        state = ServiceState.DOWN;
        log.error("Service [{}] marked DOWN after {} failed checks", target, consecutiveFailures);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public synchronized ServiceState state() {
        return state;
    }

    public synchronized ServiceHealth status() {
        Instant now = clock.instant();
        Duration uptime = upSince == null ? accumulatedUptime : accumulatedUptime.plus(Duration.between(upSince, now));
        Duration downtime = downSince == null ? Duration.ZERO : Duration.between(downSince, now);
        List<HealthCheck> all = new ArrayList<>(history);
        List<HealthCheck> recent = all.subList(Math.max(0, all.size() - RECENT_CHECKS), all.size());
        double successRate = totalChecks == 0 ? 0 : successfulChecks * 100.0 / totalChecks;
        return new ServiceHealth(
                state,
                monitoring,
                lastCheck == null ? null : lastCheck.checkedAt(),
                lastCheck == null ? null : lastCheck.duration(),
                consecutiveFailures,
                consecutiveSuccesses,
                totalChecks,
                successfulChecks,
                failedChecks,
                round(successRate),
                round(averageResponseMillis),
                uptime,
                downtime,
                lastDowntime,
                recent);
    }

    /**
     * Summarizes the checks of the trailing {@code window}. The direction compares the success
     * share of the later half of those checks with the earlier half.
     */
    public synchronized HealthTrend trends(Duration window) {
        Objects.requireNonNull(window, "window must not be null");
        Instant cutoff = clock.instant().minus(window);
        List<HealthCheck> recent = history.stream().filter(check -> !check.checkedAt().isBefore(cutoff)).toList();
        if (recent.isEmpty()) {
            return HealthTrend.empty();
        }
        List<HealthCheck> successful = recent.stream().filter(HealthCheck::success).toList();
        double averageMillis = successful.stream().mapToLong(check -> check.duration().toMillis()).average().orElse(0);

        HealthTrend.Direction direction = HealthTrend.Direction.STABLE;
        int half = recent.size() / 2;
        if (half > 0) {
            double earlier = successShare(recent.subList(0, half));
            double later = successShare(recent.subList(half, recent.size()));
            if (later > earlier + TREND_MARGIN) {
                direction = HealthTrend.Direction.IMPROVING;
            } else if (later < earlier - TREND_MARGIN) {
                direction = HealthTrend.Direction.DEGRADING;
            }
        }
        return new HealthTrend(recent.size(), successful.size(), recent.size() - successful.size(),
                round(successful.size() * 100.0 / recent.size()), round(averageMillis), direction);
    }

    /**
     * Forgets all checks and returns to {@link ServiceState#UNKNOWN}. Monitoring keeps running if
     * it was.
     */
    public synchronized void reset() {
        history.clear();
        state = ServiceState.UNKNOWN;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        totalChecks = 0;
        successfulChecks = 0;
        failedChecks = 0;
        averageResponseMillis = 0;
        accumulatedUptime = Duration.ZERO;
        upSince = null;
        downSince = null;
        lastDowntime = null;
        lastCheck = null;
        log.info("Health monitor of [{}] reset", target);
    }

    private static double successShare(List<HealthCheck> checks) {
        return checks.stream().filter(HealthCheck::success).count() / (double) checks.size();
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
