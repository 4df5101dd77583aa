package org.javai.gateway.failure;

import java.util.List;

/**
 * The downstream service answered, but its response failed validation.
 */
public class InvalidResponseException extends GatewayException {

    private final List<String> errors;

    public InvalidResponseException(String operation, List<String> errors) {
        super("Invalid response for [" + operation + "]: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }

    @Override
    public FailureClass failureClass() {
        return FailureClass.INVALID_RESPONSE;
    }
}
