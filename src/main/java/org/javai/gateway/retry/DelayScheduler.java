package org.javai.gateway.retry;

import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Schedules the continuation of a retried call after its backoff delay. Swapped out in tests so
 * delays can be observed without waiting for them.
 */
@FunctionalInterface
interface DelayScheduler {

    Future<?> schedule(Runnable task, Duration delay);

    static DelayScheduler of(ScheduledExecutorService executor) {
        return (task, delay) -> executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
