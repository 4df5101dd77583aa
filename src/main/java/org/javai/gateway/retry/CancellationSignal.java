package org.javai.gateway.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A cancellation token shared by everything one logical request waits on. Cancelling it fails
 * the attempt in flight, cancels any pending backoff and completes the retried call with a
 * {@link java.util.concurrent.CancellationException}.
 *
 * <p>A signal can only be cancelled once. Callbacks registered after cancellation run immediately.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Cancels the signal.
     *
     * @return true if this call cancelled it, false if it was already cancelled
     */
    public boolean cancel() {
        List<Runnable> pending;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        // Callbacks run outside the lock; they may register or remove other callbacks
        for (Runnable callback : pending) {
            runQuietly(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * @return a registration that removes the callback when it is no longer needed
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runQuietly(callback);
        return () -> {
        };
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle for removing a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
