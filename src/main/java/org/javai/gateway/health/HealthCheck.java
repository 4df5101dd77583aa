package org.javai.gateway.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One completed health check.
 *
 * @param error message of the last failed endpoint call, null when the check succeeded
 */
public record HealthCheck(Instant checkedAt, boolean success, Duration duration, String error) {

    public HealthCheck {
        Objects.requireNonNull(checkedAt, "checkedAt must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }
}
