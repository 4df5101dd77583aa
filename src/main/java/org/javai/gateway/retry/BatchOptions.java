package org.javai.gateway.retry;

/**
 * Options for {@link RetryExecutor#runBatch}.
 *
 * @param concurrency chunk size; at most this many operations are in flight at once
 * @param failFast if true, the first failed chunk stops the batch
 */
public record BatchOptions(int concurrency, boolean failFast) {

    public static final int DEFAULT_CONCURRENCY = 5;

    public BatchOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, was: " + concurrency);
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(DEFAULT_CONCURRENCY, true);
    }

    public static BatchOptions of(int concurrency, boolean failFast) {
        return new BatchOptions(concurrency, failFast);
    }
}
