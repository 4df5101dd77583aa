package org.javai.gateway.retry;

import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.TransientFailureClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether and when to retry a failed attempt. Immutable; build one per call or use a
 * named preset.
 *
 * <p>Before retry {@code i} (0-based) the policy waits
 * {@code min(baseDelay × backoffFactor^i + jitter, maxDelay)}, where jitter is uniform in
 * {@code [0, 0.1 × baseDelay × backoffFactor^i]}. Delays never decrease from one retry to the
 * next and never exceed {@code maxDelay}, including when the downstream asks for a longer
 * {@code Retry-After}.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder("churn.predict")
 *     .maxRetries(3)
 *     .baseDelay(Duration.ofMillis(100))
 *     .backoffFactor(2)
 *     .maxDelay(Duration.ofSeconds(5))
 *     .onRetry((error, n) -> log.info("retry {} after {}", n, error.getMessage()))
 *     .build();
 * }</pre>
 */
public final class RetryPolicy {

    public static final String STANDARD = "standard";
    public static final String EXTERNAL_SERVICE_DEFAULT = "external-service-default";
    public static final String AGGRESSIVE = "aggressive";
    public static final String CONSERVATIVE = "conservative";

    static final double JITTER_RATIO = 0.1;

    private static final FailureClassifier DEFAULT_CLASSIFIER = new TransientFailureClassifier();

    private final String label;
    private final int maxRetries;
    private final Duration baseDelay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryPredicate;
    private final RetryListener onRetry;
    private final Duration attemptTimeout;
    private final Duration overallTimeout;

    private RetryPolicy(Builder builder) {
        this.label = builder.label;
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.backoffFactor = builder.backoffFactor;
        this.maxDelay = builder.maxDelay;
        this.retryPredicate = builder.retryPredicate;
        this.onRetry = builder.onRetry;
        this.attemptTimeout = builder.attemptTimeout;
        this.overallTimeout = builder.overallTimeout;
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    /**
     * 3 retries, 1s base delay, doubling, capped at 30s.
     */
    public static RetryPolicy standard() {
        return builder(STANDARD).build();
    }

    /**
     * 3 retries, 1s base delay, doubling, capped at 10s. Retries exactly what the
     * {@link TransientFailureClassifier} calls transient.
     */
    public static RetryPolicy externalServiceDefault() {
        return builder(EXTERNAL_SERVICE_DEFAULT).maxDelay(Duration.ofSeconds(10)).build();
    }

    public static RetryPolicy aggressive() {
        return builder(AGGRESSIVE)
                .maxRetries(5)
                .baseDelay(Duration.ofMillis(500))
                .maxDelay(Duration.ofSeconds(10))
                .build();
    }

    public static RetryPolicy conservative() {
        return builder(CONSERVATIVE)
                .maxRetries(2)
                .baseDelay(Duration.ofSeconds(2))
                .maxDelay(Duration.ofSeconds(15))
                .build();
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy noRetry() {
        return builder("no-retry").maxRetries(0).build();
    }

    /**
     * Looks up a preset by name.
     *
     * @throws IllegalArgumentException if no preset has that name
     */
    public static RetryPolicy preset(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return switch (name) {
            case STANDARD -> standard();
            case EXTERNAL_SERVICE_DEFAULT -> externalServiceDefault();
            case AGGRESSIVE -> aggressive();
            case CONSERVATIVE -> conservative();
            default -> throw new IllegalArgumentException("Unknown retry preset: " + name);
        };
    }

    /**
     * Evaluates a failed attempt.
     *
     * @param attempt the attempt that just failed
     * @param previousDelay the delay before the failed attempt, zero for the first attempt
     * @param jitterSample a uniform random sample in [0, 1)
     * @param retryAfter delay requested by the downstream service, or null
     * @return Retry with a delay, or GiveUp
     */
    public RetryDecision decide(Attempt attempt, Duration previousDelay, double jitterSample, Duration retryAfter) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        if (!attempt.failed()) {
            return RetryDecision.GiveUp.because("attempt succeeded");
        }
        if (!retryPredicate.test(attempt.error())) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (attempt.index() >= maxRetries) {
            return RetryDecision.GiveUp.because("max retries reached");
        }
        return RetryDecision.Retry.after(delayBefore(attempt.index(), previousDelay, jitterSample, retryAfter));
    }

    /**
     * Computes the wait before retry {@code retryIndex} (0-based).
     */
    Duration delayBefore(int retryIndex, Duration previousDelay, double jitterSample, Duration retryAfter) {
        double current = Math.min(baseDelay.toMillis() * Math.pow(backoffFactor, retryIndex), maxDelay.toMillis());
        double jitter = clamp(jitterSample) * JITTER_RATIO * current;
        double delay = current + jitter;
        if (retryAfter != null) {
            delay = Math.max(delay, retryAfter.toMillis());
        }
        if (previousDelay != null) {
            delay = Math.max(delay, previousDelay.toMillis());
        }
        return Duration.ofMillis((long) Math.min(delay, maxDelay.toMillis()));
    }

    private static double clamp(double sample) {
        return Math.max(0.0, Math.min(sample, 1.0));
    }

    /**
     * Invokes the onRetry hook, if any. Exceptions from the hook propagate to the caller, which
     * logs them.
     */
    void notifyRetry(Throwable error, int retryNumber) {
        if (onRetry != null) {
            onRetry.onRetry(error, retryNumber);
        }
    }

    public String label() {
        return label;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public double backoffFactor() {
        return backoffFactor;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public Predicate<Throwable> retryPredicate() {
        return retryPredicate;
    }

    /**
     * @return per-attempt timeout, or null for none
     */
    public Duration attemptTimeout() {
        return attemptTimeout;
    }

    /**
     * @return deadline across all attempts, or null for none
     */
    public Duration overallTimeout() {
        return overallTimeout;
    }

    /**
     * Returns a builder pre-filled with this policy's settings.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(label);
        builder.maxRetries = maxRetries;
        builder.baseDelay = baseDelay;
        builder.backoffFactor = backoffFactor;
        builder.maxDelay = maxDelay;
        builder.retryPredicate = retryPredicate;
        builder.onRetry = onRetry;
        builder.attemptTimeout = attemptTimeout;
        builder.overallTimeout = overallTimeout;
        return builder;
    }

    @Override
    public String toString() {
        return "RetryPolicy[" + label + ", maxRetries=" + maxRetries + ", baseDelay=" + baseDelay.toMillis()
                + "ms, backoffFactor=" + backoffFactor + ", maxDelay=" + maxDelay.toMillis() + "ms]";
    }

    /**
     * Builder for {@link RetryPolicy}. Defaults: 3 retries, 1s base delay, factor 2, 30s cap,
     * retry on whatever {@link TransientFailureClassifier} calls retryable.
     */
    public static final class Builder {
        private final String label;
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);
        private Predicate<Throwable> retryPredicate = DEFAULT_CLASSIFIER::isRetryable;
        private RetryListener onRetry;
        private Duration attemptTimeout;
        private Duration overallTimeout;

        private Builder(String label) {
            this.label = Objects.requireNonNull(label, "label must not be null");
        }

        /**
         * @param maxRetries retries after the first attempt (must be >= 0)
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * @return this builder
         */
        public Builder baseDelay(Duration baseDelay) {
            Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        /**
         * @param backoffFactor multiplier applied per retry (must be > 1)
         * @return this builder
         */
        public Builder backoffFactor(double backoffFactor) {
            if (!(backoffFactor > 1.0)) {
                throw new IllegalArgumentException("backoffFactor must be > 1, was: " + backoffFactor);
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        /**
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Replaces the retry predicate. Errors it rejects end the call after one attempt.
         *
         * @return this builder
         */
        public Builder retryOn(Predicate<Throwable> retryPredicate) {
            this.retryPredicate = Objects.requireNonNull(retryPredicate, "retryPredicate must not be null");
            return this;
        }

        /**
         * Retries whatever the given classifier calls retryable.
         *
         * @return this builder
         */
        public Builder classifier(FailureClassifier classifier) {
            Objects.requireNonNull(classifier, "classifier must not be null");
            this.retryPredicate = classifier::isRetryable;
            return this;
        }

        /**
         * @return this builder
         */
        public Builder onRetry(RetryListener onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        /**
         * @param attemptTimeout timeout of each downstream call, or null for none
         * @return this builder
         */
        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /**
         * @param overallTimeout deadline across all attempts combined, or null for none
         * @return this builder
         */
        public Builder overallTimeout(Duration overallTimeout) {
            this.overallTimeout = overallTimeout;
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= baseDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
