package org.javai.gateway.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import org.javai.gateway.ModelType;

import java.time.Instant;
import java.util.Objects;

/**
 * A degraded-but-usable substitute for a live response.
 *
 * @param category the model category, or null for the generic entry served when the category is unknown
 * @param payload the substitute response document; a private copy per entry
 * @param reason human-readable reason, e.g. "AI/ML service unavailable"
 * @param configured false for the generic "no fallback configured" entry
 * @param servedAt when the entry was handed out
 * @param correlationId correlation id of the request it was served to (may be null)
 */
public record FallbackEntry(
        ModelType category,
        JsonNode payload,
        String reason,
        boolean configured,
        Instant servedAt,
        String correlationId
) {

    public FallbackEntry {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(servedAt, "servedAt must not be null");
    }

    /**
     * Always true; a fallback entry is never a live result.
     */
    public boolean isFallback() {
        return true;
    }
}
