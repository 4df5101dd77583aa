package org.javai.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

/**
 * One request to the prediction service.
 *
 * @param headers includes {@value #CORRELATION_HEADER}
 */
public record PredictionCall(ModelType modelType, String endpoint, ObjectNode body, Map<String, String> headers) {

    public static final String CORRELATION_HEADER = "X-Correlation-ID";

    public PredictionCall {
        Objects.requireNonNull(modelType, "modelType must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Objects.requireNonNull(body, "body must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    static PredictionCall of(ModelType modelType, ObjectNode body, String correlationId) {
        return new PredictionCall(modelType, modelType.endpoint(), body, Map.of(CORRELATION_HEADER, correlationId));
    }

    public String correlationId() {
        return headers.get(CORRELATION_HEADER);
    }
}
