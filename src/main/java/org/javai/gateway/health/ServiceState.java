package org.javai.gateway.health;

/**
 * Verdict of the {@link HealthMonitor} about the downstream service.
 */
public enum ServiceState {
    /** Not enough checks yet to decide. */
    UNKNOWN,
    UP,
    DOWN
}
