package org.javai.gateway.retry;

import org.javai.gateway.breaker.CircuitBreaker;

import java.util.Objects;

/**
 * Per-call collaborators of a retried call.
 *
 * @param operation name used in logs and failure reports
 * @param correlationId the request's correlation id (may be null)
 * @param breaker breaker consulted before every attempt (may be null)
 * @param cancellation signal that aborts the whole call
 * @param attemptListener told about every failed attempt
 */
public record RunContext(
        String operation,
        String correlationId,
        CircuitBreaker breaker,
        CancellationSignal cancellation,
        AttemptListener attemptListener
) {

    public RunContext {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        attemptListener = attemptListener == null ? AttemptListener.NONE : attemptListener;
    }

    public static RunContext of(String operation) {
        return new RunContext(operation, null, null, CancellationSignal.create(), AttemptListener.NONE);
    }

    public RunContext withCorrelationId(String correlationId) {
        return new RunContext(operation, correlationId, breaker, cancellation, attemptListener);
    }

    public RunContext withBreaker(CircuitBreaker breaker) {
        return new RunContext(operation, correlationId, breaker, cancellation, attemptListener);
    }

    public RunContext withCancellation(CancellationSignal cancellation) {
        return new RunContext(operation, correlationId, breaker, cancellation, attemptListener);
    }

    public RunContext withOperation(String operation) {
        return new RunContext(operation, correlationId, breaker, cancellation, attemptListener);
    }

    public RunContext withAttemptListener(AttemptListener attemptListener) {
        return new RunContext(operation, correlationId, breaker, cancellation, attemptListener);
    }
}
