package org.javai.gateway.health;

import java.time.Instant;

/**
 * One recorded error.
 *
 * @param id random identifier, quoted in logs so the record can be found later
 * @param timestamp when it was recorded
 * @param errorType the failure class name, e.g. {@code DOWNSTREAM_SERVER}
 * @param code the failure code, e.g. {@code http:503}
 * @param message the error message
 * @param context where it happened
 */
public record ErrorRecord(
        String id,
        Instant timestamp,
        String errorType,
        String code,
        String message,
        ErrorContext context
) {
}
