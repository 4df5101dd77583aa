package org.javai.gateway.failure;

/**
 * Base type of the exceptions the gateway raises itself. Each subtype knows its own
 * {@link FailureClass}, so classification never depends on message text.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureClass failureClass();

    public FailureCode code() {
        return FailureCode.of("gateway", failureClass().name().toLowerCase());
    }
}
