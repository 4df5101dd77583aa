package org.javai.gateway.metrics;

/**
 * How a tracked request ended.
 */
public enum RequestOutcome {
    SUCCESS,
    FAILURE,
    FALLBACK;

    public boolean isError() {
        return this != SUCCESS;
    }

    public String label() {
        return name().toLowerCase();
    }
}
