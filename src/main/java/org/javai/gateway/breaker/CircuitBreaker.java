package org.javai.gateway.breaker;

import org.javai.gateway.failure.BreakerOpenException;
import org.javai.gateway.failure.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * A three-state circuit breaker guarding one downstream target.
 *
 * <ul>
 *   <li>CLOSED: calls pass through. The breaker opens once {@code failureThreshold} consecutive
 *       counted failures have occurred within {@code failureWindow}.</li>
 *   <li>OPEN: calls fail immediately with {@link BreakerOpenException}. After
 *       {@code openDuration} the next call moves the breaker to HALF_OPEN.</li>
 *   <li>HALF_OPEN: exactly one probe call is let through; concurrent callers are rejected until it
 *       resolves. A successful probe closes the breaker, a failed one reopens it and restarts the
 *       open timer.</li>
 * </ul>
 *
 * <p>The breaker never serves fallbacks; deciding what to return after a rejection is the
 * caller's job. All state is guarded by a single lock; listeners are notified outside it.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private enum Permit { NORMAL, PROBE }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private BreakerState state = BreakerState.CLOSED;
    private final Deque<Instant> recentFailures = new ArrayDeque<>();
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    private long totalRequests;
    private long successes;
    private long failures;
    private long rejections;
    private long completedCalls;
    private long totalResponseMillis;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Receives state changes. Called outside the breaker's lock, on the thread that caused the change.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String breakerName, BreakerState from, BreakerState to);
    }

    public void addListener(TransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Runs a call through the breaker.
     *
     * @return the call's future, or a future failed with {@link BreakerOpenException} if the call
     *         was rejected without being made
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> call) {
        Objects.requireNonNull(call, "call must not be null");
        Permit permit = tryAcquire();
        if (permit == null) {
            return CompletableFuture.failedFuture(new BreakerOpenException(name, retryAt()));
        }

        Instant startedAt = clock.instant();
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(call.get(), "call returned null");
        } catch (RuntimeException e) {
            onComplete(permit, startedAt, e);
            return CompletableFuture.failedFuture(e);
        }
        return stage.whenComplete((value, error) -> onComplete(permit, startedAt, error)).toCompletableFuture();
    }

    private Permit tryAcquire() {
        BreakerState from = null;
        Permit permit;
        synchronized (lock) {
            totalRequests++;
            if (state == BreakerState.OPEN && !clock.instant().isBefore(openedAt.plus(config.openDuration()))) {
                from = state;
                state = BreakerState.HALF_OPEN;
            }
            permit = switch (state) {
                case CLOSED -> Permit.NORMAL;
                case OPEN -> null;
                case HALF_OPEN -> {
                    if (probeInFlight) {
                        yield null;
                    }
                    probeInFlight = true;
                    yield Permit.PROBE;
                }
            };
            if (permit == null) {
                rejections++;
            }
        }
        if (from != null) {
            notifyListeners(from, BreakerState.HALF_OPEN);
        }
        return permit;
    }

    private void onComplete(Permit permit, Instant startedAt, Throwable error) {
        Instant now = clock.instant();
        BreakerState from;
        BreakerState to;
        synchronized (lock) {
            from = state;
            completedCalls++;
            totalResponseMillis += Math.max(0, Duration.between(startedAt, now).toMillis());

            if (error == null) {
                successes++;
                if (permit == Permit.PROBE) {
                    probeInFlight = false;
                    close();
                } else if (state == BreakerState.CLOSED) {
                    consecutiveFailures = 0;
                    recentFailures.clear();
                }
            } else if (!config.recordFailure().test(FailureClassifier.unwrap(error))) {
                // Not counted; a half-open probe that ends this way leaves the breaker half-open.
                if (permit == Permit.PROBE) {
                    probeInFlight = false;
                }
            } else {
                failures++;
                if (permit == Permit.PROBE) {
                    probeInFlight = false;
                    consecutiveFailures++;
                    open(now);
                } else if (state == BreakerState.CLOSED) {
                    consecutiveFailures++;
                    recentFailures.addLast(now);
                    pruneWindow(now);
                    if (recentFailures.size() >= config.failureThreshold()) {
                        open(now);
                    }
                }
            }
            to = state;
        }
        if (from != to) {
            notifyListeners(from, to);
        }
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(config.failureWindow());
        while (!recentFailures.isEmpty() && recentFailures.peekFirst().isBefore(cutoff)) {
            recentFailures.removeFirst();
        }
    }

    private void open(Instant now) {
        state = BreakerState.OPEN;
        openedAt = now;
        recentFailures.clear();
    }

    private void close() {
        state = BreakerState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        recentFailures.clear();
    }

    private Instant retryAt() {
        synchronized (lock) {
            return state == BreakerState.OPEN ? openedAt.plus(config.openDuration()) : null;
        }
    }

    /**
     * Forces the breaker back to CLOSED and clears its failure count.
     */
    public void reset() {
        BreakerState from;
        synchronized (lock) {
            from = state;
            close();
            probeInFlight = false;
        }
        if (from != BreakerState.CLOSED) {
            notifyListeners(from, BreakerState.CLOSED);
        }
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public BreakerState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * @return a consistent snapshot of state and statistics
     */
    public CircuitBreakerState snapshot() {
        synchronized (lock) {
            double averageMillis = completedCalls == 0 ? 0.0 : (double) totalResponseMillis / completedCalls;
            return new CircuitBreakerState(name, state, consecutiveFailures, openedAt, probeInFlight,
                    totalRequests, successes, failures, rejections, averageMillis);
        }
    }

    private void notifyListeners(BreakerState from, BreakerState to) {
        log.info("Circuit breaker [{}] {} -> {}", name, from, to);
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(name, from, to);
            } catch (RuntimeException e) {
                log.warn("Transition listener of breaker [{}] failed: {}", name, e.getMessage(), e);
            }
        }
    }
}
