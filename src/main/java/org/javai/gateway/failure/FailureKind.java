package org.javai.gateway.failure;

import java.time.Duration;
import java.util.Objects;

/**
 * The classification of a single throwable.
 *
 * @param code stable identifier of the failure
 * @param message human-readable description
 * @param failureClass the taxonomy entry that drives retry and fallback decisions
 * @param retryAfter delay requested by the downstream service, or null
 */
public record FailureKind(FailureCode code, String message, FailureClass failureClass, Duration retryAfter) {

    public FailureKind {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(failureClass, "failureClass must not be null");
    }

    public static FailureKind of(FailureCode code, String message, FailureClass failureClass) {
        return new FailureKind(code, message, failureClass, null);
    }

    public boolean retryable() {
        return failureClass.retryable();
    }
}
