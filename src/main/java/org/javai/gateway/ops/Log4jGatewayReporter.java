package org.javai.gateway.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.Failure;
import org.javai.gateway.failure.FailureClass;

import java.time.Duration;
import java.util.Map;

/**
 * Reports gateway events using Log4j2 with one marker per event type, so appenders can route
 * retries, fallbacks and breaker transitions separately.
 *
 * <p>Failures are logged at a level derived from their class:
 * <ul>
 *   <li>{@code MAPPING}, {@code UNKNOWN} → ERROR</li>
 *   <li>{@code DOWNSTREAM_SERVER}, {@code DOWNSTREAM_CLIENT}, {@code INVALID_RESPONSE}, {@code DEADLINE_EXCEEDED} → WARN</li>
 *   <li>{@code TRANSIENT_NETWORK}, {@code RATE_LIMITED}, {@code BREAKER_OPEN} → INFO</li>
 *   <li>{@code CANCELLED} → DEBUG</li>
 * </ul>
 */
public class Log4jGatewayReporter implements GatewayReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker FALLBACK_MARKER = MarkerManager.getMarker("FALLBACK");
	private static final Marker BREAKER_MARKER = MarkerManager.getMarker("BREAKER");

	private final Logger logger;

	/**
	 * Creates a Log4jGatewayReporter using the default logger name.
	 */
	public Log4jGatewayReporter() {
		this(LogManager.getLogger("org.javai.gateway.GatewayReporter"));
	}

	/**
	 * Creates a Log4jGatewayReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jGatewayReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.failureClass()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyLabel) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} for operation [{}] in {}ms with policy [{}]. Class: {}, Code: {}, CorrelationId: {}",
				attemptNumber,
				failure.operation(),
				delay.toMillis(),
				policyLabel,
				failure.failureClass(),
				failure.code(),
				failure.correlationId());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyLabel) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on operation [{}] after {} attempts with policy [{}]. Class: {}, Code: {}, CorrelationId: {}",
				failure.operation(),
				totalAttempts,
				policyLabel,
				failure.failureClass(),
				failure.code(),
				failure.correlationId());
	}

	@Override
	public void reportFallback(Failure failure, String category, String reason) {
		logger.atWarn()
			.withMarker(FALLBACK_MARKER)
			.log("Serving fallback for [{}] after {} on operation [{}]: {}. CorrelationId: {}",
				category,
				failure.failureClass(),
				failure.operation(),
				reason,
				failure.correlationId());
	}

	@Override
	public void reportBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
		Level level = to == BreakerState.OPEN ? Level.WARN : Level.INFO;
		logger.atLevel(level)
			.withMarker(BREAKER_MARKER)
			.log("Circuit breaker [{}] {} -> {}", breakerName, from, to);
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s]: %s \
			| code=%s, class=%s, attempt=%d%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.code(),
				failure.failureClass(),
				failure.attempt(),
				formatCorrelationId(failure.correlationId()),
				formatTags(failure.tags())
			).trim();
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? ", correlationId=" + correlationId : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	static Level levelFor(FailureClass failureClass) {
		return switch (failureClass) {
			case MAPPING, UNKNOWN -> Level.ERROR;
			case DOWNSTREAM_SERVER, DOWNSTREAM_CLIENT, INVALID_RESPONSE, DEADLINE_EXCEEDED -> Level.WARN;
			case TRANSIENT_NETWORK, RATE_LIMITED, BREAKER_OPEN -> Level.INFO;
			case CANCELLED -> Level.DEBUG;
		};
	}
}
