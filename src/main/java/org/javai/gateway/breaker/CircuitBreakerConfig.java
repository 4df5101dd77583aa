package org.javai.gateway.breaker;

import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.TransientFailureClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Thresholds of a {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive counted failures, all inside {@code failureWindow}, that open the breaker
 * @param failureWindow how far back a failure still counts toward the threshold
 * @param openDuration how long the breaker stays open before admitting a probe
 * @param recordFailure decides whether an error counts toward the threshold at all
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration failureWindow,
        Duration openDuration,
        Predicate<Throwable> recordFailure
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_FAILURE_WINDOW = Duration.ofSeconds(10);
    public static final Duration DEFAULT_OPEN_DURATION = Duration.ofSeconds(30);

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        Objects.requireNonNull(failureWindow, "failureWindow must not be null");
        Objects.requireNonNull(openDuration, "openDuration must not be null");
        Objects.requireNonNull(recordFailure, "recordFailure must not be null");
        if (failureWindow.isNegative() || failureWindow.isZero()) {
            throw new IllegalArgumentException("failureWindow must be positive");
        }
        if (openDuration.isNegative()) {
            throw new IllegalArgumentException("openDuration must not be negative");
        }
    }

    /**
     * Counts every failure whose class trips breakers; client errors, mapping errors,
     * cancellations and rejections by another breaker do not count.
     */
    public static Predicate<Throwable> countedFailures(FailureClassifier classifier) {
        return t -> classifier.classify("breaker", t).failureClass().tripsBreaker();
    }

    public static CircuitBreakerConfig defaults() {
        return of(DEFAULT_FAILURE_THRESHOLD, DEFAULT_FAILURE_WINDOW, DEFAULT_OPEN_DURATION);
    }

    public static CircuitBreakerConfig of(int failureThreshold, Duration failureWindow, Duration openDuration) {
        return new CircuitBreakerConfig(failureThreshold, failureWindow, openDuration,
                countedFailures(new TransientFailureClassifier()));
    }
}
