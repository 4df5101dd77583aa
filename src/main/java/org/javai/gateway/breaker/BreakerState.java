package org.javai.gateway.breaker;

/**
 * States of a {@link CircuitBreaker}. The gauge value is what the breaker-state metric exports.
 */
public enum BreakerState {

    /** Calls pass through; failures are counted. */
    CLOSED(0),

    /** Calls are rejected without reaching downstream. */
    OPEN(1),

    /** One probe call is allowed through; everything else is rejected until it resolves. */
    HALF_OPEN(2);

    private final int gaugeValue;

    BreakerState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public int gaugeValue() {
        return gaugeValue;
    }
}
