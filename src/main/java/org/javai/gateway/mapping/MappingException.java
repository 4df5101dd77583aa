package org.javai.gateway.mapping;

import org.javai.gateway.failure.FailureClass;
import org.javai.gateway.failure.GatewayException;

import java.util.Objects;

/**
 * A request could not be mapped because a required field is missing or invalid. This is a
 * caller bug: it is never retried and never answered with a fallback.
 */
public class MappingException extends GatewayException {

    private final MappingResult result;

    public MappingException(String operation, MappingResult result) {
        super("Cannot map request for [" + operation + "]: " + String.join("; ", result.errors()));
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public MappingResult result() {
        return result;
    }

    @Override
    public FailureClass failureClass() {
        return FailureClass.MAPPING;
    }
}
