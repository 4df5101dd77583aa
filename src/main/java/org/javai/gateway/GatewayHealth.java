package org.javai.gateway;

import org.javai.gateway.breaker.CircuitBreakerState;
import org.javai.gateway.health.ErrorStats;
import org.javai.gateway.health.HealthStatus;
import org.javai.gateway.health.ServiceHealth;

import java.util.List;
import java.util.Objects;

/**
 * A point-in-time health report, suitable for a liveness or readiness probe.
 *
 * @param healthStatus the error-rate status, raised to at least WARNING while a breaker is not closed
 *                     and to at least CRITICAL while the health monitor reports the service down
 * @param serviceHealth what the health monitor has observed, also when it is not running
 */
public record GatewayHealth(HealthStatus healthStatus, ErrorStats errorStats, List<CircuitBreakerState> circuitBreakerStates,
                            ServiceHealth serviceHealth) {

    public GatewayHealth {
        Objects.requireNonNull(healthStatus, "healthStatus must not be null");
        Objects.requireNonNull(errorStats, "errorStats must not be null");
        Objects.requireNonNull(serviceHealth, "serviceHealth must not be null");
        circuitBreakerStates = List.copyOf(circuitBreakerStates);
    }

    public boolean isHealthy() {
        return healthStatus == HealthStatus.HEALTHY;
    }
}
