package org.javai.gateway.retry;

/**
 * A fail-fast batch stopped after a chunk containing a failure. The cause is the first failure
 * by position; {@link #partial()} holds everything that ran.
 */
public class BatchAbortedException extends RuntimeException {

    private final transient BatchResult<?> partial;

    public BatchAbortedException(Throwable firstError, BatchResult<?> partial) {
        super("Batch aborted after failure: " + firstError.getMessage(), firstError);
        this.partial = partial;
    }

    public BatchResult<?> partial() {
        return partial;
    }
}
