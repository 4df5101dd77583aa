package org.javai.gateway.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The outcome of a retry policy evaluation.
 */
public sealed interface RetryDecision {

    /**
     * Retry after the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop retrying; the failure is final.
     */
    record GiveUp(String reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }
    }
}
