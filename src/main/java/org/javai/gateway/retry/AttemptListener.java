package org.javai.gateway.retry;

import org.javai.gateway.failure.Failure;

/**
 * Observes every failed attempt of one call, whether or not it is retried. Called before the
 * retry decision, on the thread that completed the attempt.
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = failure -> { };

    void onAttemptFailed(Failure failure);
}
