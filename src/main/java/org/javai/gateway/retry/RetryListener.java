package org.javai.gateway.retry;

/**
 * Hook invoked before the backoff wait that precedes each retry.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param error the error of the attempt that just failed
     * @param retryNumber the retry about to be scheduled, starting at 1
     */
    void onRetry(Throwable error, int retryNumber);
}
