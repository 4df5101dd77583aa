package org.javai.gateway.failure;

import java.time.Duration;

/**
 * The overall deadline of a retried call elapsed, or would elapse during the next backoff.
 * The cause, when present, is the error of the last completed attempt.
 */
public class DeadlineExceededException extends GatewayException {

    public DeadlineExceededException(String operation, Duration overallTimeout, Throwable lastError) {
        super("Deadline of " + overallTimeout.toMillis() + "ms exceeded for [" + operation + "]", lastError);
    }

    @Override
    public FailureClass failureClass() {
        return FailureClass.DEADLINE_EXCEEDED;
    }
}
