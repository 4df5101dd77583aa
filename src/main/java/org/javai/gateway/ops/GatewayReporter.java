package org.javai.gateway.ops;

import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.Failure;

import java.time.Duration;

/**
 * Reports gateway events for observability and forensic reconstruction.
 * Implementations might emit structured logs, JSON lines or alerts. Implementations must not
 * throw: a failing reporter must never break a gateway call.
 */
public interface GatewayReporter {

	/**
	 * Reports a failure occurrence.
	 */
	void report(Failure failure);

	/**
	 * Reports that a failed attempt is about to be retried.
	 *
	 * @param failure the failure that triggered the retry
	 * @param attemptNumber the retry about to happen (1-based)
	 * @param delay the backoff before the retry
	 * @param policyLabel the retry policy being applied
	 */
	default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyLabel) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that a retried call ended in failure.
	 *
	 * @param failure the final failure
	 * @param totalAttempts the total number of attempts made
	 * @param policyLabel the retry policy that was applied
	 */
	default void reportRetryExhausted(Failure failure, int totalAttempts, String policyLabel) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that a fallback entry was served in place of a live response.
	 *
	 * @param failure the failure that caused the fallback
	 * @param category the model category whose fallback was served
	 * @param reason the reason stamped on the fallback entry
	 */
	default void reportFallback(Failure failure, String category, String reason) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports a circuit breaker state change.
	 */
	default void reportBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static GatewayReporter noOp() {
		return failure -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static GatewayReporter composite(GatewayReporter... reporters) {
		return CompositeGatewayReporter.of(reporters);
	}
}
