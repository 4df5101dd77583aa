package org.javai.gateway.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds one fallback payload per {@link ModelType}.
 *
 * <p>{@link #get} never throws: a registered category yields its entry, anything else yields a
 * generic "service temporarily unavailable" entry marked as not configured. Entries may be
 * replaced at any time through {@link #set} but never removed.
 */
public final class FallbackProvider {

    private static final Logger log = LoggerFactory.getLogger(FallbackProvider.class);

    public static final String DEFAULT_REASON = "AI/ML service unavailable";
    public static final String NOT_CONFIGURED_REASON = "No fallback configured";

    private final Map<ModelType, Registration> entries = new EnumMap<>(ModelType.class);
    private final Clock clock;

    private record Registration(JsonNode payload, String reason) {}

    public FallbackProvider() {
        this(Clock.systemUTC());
    }

    public FallbackProvider(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a provider seeded with {@link FallbackCatalog#defaults()}.
     */
    public static FallbackProvider withDefaults(Clock clock) {
        FallbackProvider provider = new FallbackProvider(clock);
        FallbackCatalog.defaults().forEach(provider::set);
        return provider;
    }

    /**
     * Registers or replaces the payload of a category with the default reason.
     */
    public void set(ModelType category, JsonNode payload) {
        set(category, payload, DEFAULT_REASON);
    }

    /**
     * Registers or replaces the payload of a category. Setting the same payload twice has no
     * further effect.
     */
    public void set(ModelType category, JsonNode payload, String reason) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        synchronized (entries) {
            entries.put(category, new Registration(payload.deepCopy(), reason));
        }
        log.debug("Fallback for [{}] set: {}", category.category(), reason);
    }

    /**
     * Returns the entry for a category, stamped with the correlation id and the current time.
     * Never throws and never returns null.
     */
    public FallbackEntry get(ModelType category, String correlationId) {
        Instant now = clock.instant();
        Registration registration;
        synchronized (entries) {
            registration = category == null ? null : entries.get(category);
        }
        if (registration == null) {
            log.warn("No fallback configured for [{}] (correlationId={})",
                    category == null ? "unknown" : category.category(), correlationId);
            return new FallbackEntry(category, notConfiguredPayload(), NOT_CONFIGURED_REASON, false, now, correlationId);
        }
        return new FallbackEntry(category, registration.payload().deepCopy(), registration.reason(), true, now, correlationId);
    }

    public boolean isRegistered(ModelType category) {
        synchronized (entries) {
            return entries.containsKey(category);
        }
    }

    public Set<ModelType> registeredCategories() {
        synchronized (entries) {
            return entries.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(entries.keySet()));
        }
    }

    /**
     * Verifies that every category a caller will route has a fallback.
     *
     * @throws IllegalStateException naming the categories without one
     */
    public void requireRegistered(Collection<ModelType> categories) {
        Set<ModelType> missing;
        synchronized (entries) {
            missing = categories.stream()
                    .filter(category -> !entries.containsKey(category))
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(ModelType.class)));
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No fallback registered for: " + missing.stream()
                    .map(ModelType::category)
                    .collect(Collectors.joining(", ")));
        }
    }

    private static ObjectNode notConfiguredPayload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("error", "Service temporarily unavailable");
        payload.put("is_fallback", true);
        payload.put("fallback_reason", NOT_CONFIGURED_REASON);
        return payload;
    }
}
