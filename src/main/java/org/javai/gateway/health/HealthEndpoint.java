package org.javai.gateway.health;

import java.util.concurrent.CompletionStage;

/**
 * One call to the downstream health endpoint. A stage completed with a non-null value counts as
 * a healthy answer; a failed stage, a null value or a synchronous throw counts as unhealthy.
 */
@FunctionalInterface
public interface HealthEndpoint {

    CompletionStage<?> check();
}
