package org.javai.gateway.health;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Where a recorded error happened. Every field is optional.
 *
 * @param service the downstream service or component
 * @param endpoint the endpoint that was called
 * @param operation the logical operation, e.g. {@code churn.predict}
 * @param correlationId the request's correlation id
 * @param attempt 1-based attempt number, or null
 * @param maxRetries retries allowed by the policy, or null
 * @param details extra key-value context; values under sensitive keys are redacted
 */
public record ErrorContext(
        String service,
        String endpoint,
        String operation,
        String correlationId,
        Integer attempt,
        Integer maxRetries,
        Map<String, String> details
) {

    static final String REDACTED = "[REDACTED]";
    private static final Set<String> SENSITIVE_KEYS =
            Set.of("authorization", "cookie", "x-api-key", "password", "token", "secret", "key");

    public ErrorContext {
        details = details == null ? Map.of() : redact(details);
    }

    public static ErrorContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static Map<String, String> redact(Map<String, String> details) {
        Map<String, String> copy = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, isSensitive(key) ? REDACTED : value);
            }
        });
        return Map.copyOf(copy);
    }

    private static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }

    public static final class Builder {
        private String service;
        private String endpoint;
        private String operation;
        private String correlationId;
        private Integer attempt;
        private Integer maxRetries;
        private Map<String, String> details;

        private Builder() {}

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder attempt(int attempt, int maxRetries) {
            this.attempt = attempt;
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder details(Map<String, String> details) {
            this.details = details;
            return this;
        }

        public ErrorContext build() {
            return new ErrorContext(service, endpoint, operation, correlationId, attempt, maxRetries, details);
        }
    }
}
