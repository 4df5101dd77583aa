package org.javai.gateway.retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Results of a batch, indexed by the original position of each operation. For every index
 * exactly one of {@code results().get(i)} and {@code errors().get(i)} is non-null, unless the
 * operation never ran because the batch was aborted, in which case both are null.
 */
public final class BatchResult<T> {

    private final List<T> results;
    private final List<Throwable> errors;

    BatchResult(List<T> results, List<Throwable> errors) {
        if (results.size() != errors.size()) {
            throw new IllegalArgumentException("results and errors must have the same size");
        }
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * @return successful values by position, null where the operation failed or did not run
     */
    public List<T> results() {
        return results;
    }

    /**
     * @return errors by position, null where the operation succeeded or did not run
     */
    public List<Throwable> errors() {
        return errors;
    }

    public int size() {
        return results.size();
    }

    public long successCount() {
        return results.stream().filter(r -> r != null).count();
    }

    public long failureCount() {
        return errors.stream().filter(e -> e != null).count();
    }

    public Optional<Throwable> firstError() {
        return errors.stream().filter(e -> e != null).findFirst();
    }
}
