package org.javai.gateway;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A request identifier plus a small metadata bag, threaded through every log line, metric and
 * fallback payload produced for one unit of work.
 *
 * <p>Contexts are immutable; {@link #with(String, String)} returns a new one. While a gateway call
 * runs on the caller's thread the id is also published to the SLF4J MDC under
 * {@link #MDC_KEY} via {@link #bind()}.
 *
 * @param correlationId the identifier, never blank
 * @param metadata free-form key-value pairs, e.g. organization or user id
 */
public record CorrelationContext(String correlationId, Map<String, String> metadata) {

    public static final String MDC_KEY = "correlationId";

    public CorrelationContext {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        if (correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a context with a freshly generated id.
     */
    public static CorrelationContext generate() {
        return new CorrelationContext(UUID.randomUUID().toString(), Map.of());
    }

    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, Map.of());
    }

    /**
     * Uses the caller-supplied id when present, otherwise generates one.
     */
    public static CorrelationContext ofNullable(String correlationId) {
        return correlationId == null || correlationId.isBlank() ? generate() : of(correlationId);
    }

    public CorrelationContext with(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new CorrelationContext(correlationId, copy);
    }

    public String get(String key) {
        return metadata.get(key);
    }

    /**
     * Publishes the id to the MDC of the current thread until the returned scope is closed.
     * The previous value, if any, is restored on close.
     */
    public Scope bind() {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, correlationId);
        return () -> {
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        };
    }

    /**
     * An MDC binding that can be closed without a checked exception.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
