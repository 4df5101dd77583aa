package org.javai.gateway.failure;

import java.time.Duration;
import java.util.Optional;

/**
 * Raised by a transport when the downstream service answers with a non-success HTTP status.
 * Classified as {@link FailureClass#RATE_LIMITED} for 429, {@link FailureClass#TRANSIENT_NETWORK}
 * for 408, {@link FailureClass#DOWNSTREAM_SERVER} for 5xx and {@link FailureClass#DOWNSTREAM_CLIENT}
 * for every other status.
 */
public class DownstreamStatusException extends GatewayException {

    private final int status;
    private final Duration retryAfter;

    public DownstreamStatusException(int status, String message) {
        this(status, message, null);
    }

    public DownstreamStatusException(int status, String message, Duration retryAfter) {
        super("HTTP " + status + ": " + message);
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("status must be an error status, was: " + status);
        }
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public int status() {
        return status;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public FailureClass failureClass() {
        if (status == 429) {
            return FailureClass.RATE_LIMITED;
        }
        if (status == 408) {
            return FailureClass.TRANSIENT_NETWORK;
        }
        if (status >= 500) {
            return FailureClass.DOWNSTREAM_SERVER;
        }
        return FailureClass.DOWNSTREAM_CLIENT;
    }

    @Override
    public FailureCode code() {
        return FailureCode.httpStatus(status);
    }
}
