package org.javai.gateway.failure;

import java.time.Instant;

/**
 * Raised without calling downstream when a circuit breaker rejects a call, either because it is
 * open or because its half-open probe is already in flight.
 */
public class BreakerOpenException extends GatewayException {

    private final String breakerName;
    private final Instant retryAt;

    public BreakerOpenException(String breakerName, Instant retryAt) {
        super("Circuit breaker [" + breakerName + "] is open" + (retryAt != null ? " until " + retryAt : ""));
        this.breakerName = breakerName;
        this.retryAt = retryAt;
    }

    public String breakerName() {
        return breakerName;
    }

    /**
     * @return when the breaker will next admit a probe, or null if a probe is already running
     */
    public Instant retryAt() {
        return retryAt;
    }

    @Override
    public FailureClass failureClass() {
        return FailureClass.BREAKER_OPEN;
    }

    @Override
    public FailureCode code() {
        return FailureCode.of("breaker", "open");
    }
}
