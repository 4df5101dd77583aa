package org.javai.gateway.failure;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A classified failure with the context needed to reconstruct what happened: which operation,
 * which attempt, and which correlation id.
 *
 * @param kind the classification
 * @param exception the underlying exception (may be null)
 * @param operation the operation that failed (e.g., "churn.predict")
 * @param occurredAt when the failure happened
 * @param correlationId request correlation identifier (may be null)
 * @param attempt 1-based attempt number, or 0 when not part of a retried call
 * @param tags additional key-value metadata
 */
public record Failure(
        FailureKind kind,
        Throwable exception,
        String operation,
        Instant occurredAt,
        String correlationId,
        int attempt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static Failure of(FailureKind kind, Throwable exception, String operation, String correlationId, int attempt) {
        return new Failure(kind, exception, operation, Instant.now(), correlationId, attempt, null);
    }

    public FailureCode code() {
        return kind.code();
    }

    public String message() {
        return kind.message();
    }

    public FailureClass failureClass() {
        return kind.failureClass();
    }

    /**
     * Returns a copy carrying the given tags.
     */
    public Failure withTags(Map<String, String> tags) {
        return new Failure(kind, exception, operation, occurredAt, correlationId, attempt, tags);
    }
}
