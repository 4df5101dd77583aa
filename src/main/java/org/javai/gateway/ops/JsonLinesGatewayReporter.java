package org.javai.gateway.ops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Reports gateway events as JSON lines via SLF4J, one object per event. The lines carry the
 * correlation id, attempt number and failure class of every event so a single request can be
 * reconstructed from the log alone.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"msp.churn.predict","attemptNumber":1,...}
 * }</pre>
 */
public class JsonLinesGatewayReporter implements GatewayReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.gateway.Events";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger log = LoggerFactory.getLogger(JsonLinesGatewayReporter.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a reporter with no namespace and the default logger.
	 */
	public JsonLinesGatewayReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a reporter with the specified namespace and the default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public JsonLinesGatewayReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Package-private for testing.
	 */
	JsonLinesGatewayReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode json = base("failure", failure);
		json.put("message", failure.message());
		json.put("attempt", failure.attempt());
		if (!failure.tags().isEmpty()) {
			ObjectNode tags = json.putObject("tags");
			for (Map.Entry<String, String> tag : failure.tags().entrySet()) {
				tags.put(tag.getKey(), tag.getValue());
			}
		}
		emit(json);
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyLabel) {
		ObjectNode json = base("retry_attempt", failure);
		json.put("attemptNumber", attemptNumber);
		json.put("delayMs", delay.toMillis());
		json.put("policy", policyLabel);
		emit(json);
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyLabel) {
		ObjectNode json = base("retry_exhausted", failure);
		json.put("totalAttempts", totalAttempts);
		json.put("policy", policyLabel);
		emit(json);
	}

	@Override
	public void reportFallback(Failure failure, String category, String reason) {
		ObjectNode json = base("fallback", failure);
		json.put("category", category);
		json.put("reason", reason);
		emit(json);
	}

	@Override
	public void reportBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
		ObjectNode json = mapper.createObjectNode();
		json.put("eventType", "breaker_transition");
		json.put("timestamp", ISO_FORMATTER.format(Instant.now()));
		json.put("trackingKey", withNamespace(breakerName));
		json.put("from", from.name());
		json.put("to", to.name());
		emit(json);
	}

	private ObjectNode base(String eventType, Failure failure) {
		ObjectNode json = mapper.createObjectNode();
		json.put("eventType", eventType);
		json.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		json.put("trackingKey", buildTrackingKey(failure));
		json.put("code", failure.code().toString());
		json.put("class", failure.failureClass().name());
		json.put("operation", failure.operation());
		if (failure.correlationId() != null) {
			json.put("correlationId", failure.correlationId());
		}
		return json;
	}

	private void emit(ObjectNode json) {
		try {
			logger.info(mapper.writeValueAsString(json));
		} catch (JsonProcessingException | RuntimeException e) {
			log.warn("Could not emit gateway event {}: {}", json.path("eventType").asText(), e.getMessage());
		}
	}

	String buildTrackingKey(Failure failure) {
		return withNamespace(failure.operation());
	}

	private String withNamespace(String key) {
		return namespace == null ? key : namespace + "." + key;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
