package org.javai.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The asynchronous call primitive to the prediction service.
 *
 * <p>Implementations signal HTTP errors with
 * {@link org.javai.gateway.failure.DownstreamStatusException} and network problems with the
 * usual {@link java.io.IOException} subtypes, so the gateway can tell transient failures from
 * permanent ones. They should honor cancellation of the returned stage where they can.
 */
@FunctionalInterface
public interface PredictionTransport {

    CompletionStage<JsonNode> send(PredictionCall call);

    /**
     * Calls the service's health endpoint. A failed stage or a null body means unhealthy.
     * Transports without such an endpoint fail, so an enabled health monitor reports the service down.
     */
    default CompletionStage<JsonNode> checkHealth() {
        return CompletableFuture.failedFuture(new UnsupportedOperationException("Transport does not expose a health check"));
    }
}
