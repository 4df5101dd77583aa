package org.javai.gateway.failure;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies exceptions raised by downstream calls into the gateway's error taxonomy.
 * Implementations should be deterministic: the same throwable always yields the same class.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a FailureKind.
     *
     * @param operation the operation that was being performed
     * @param throwable the exception that occurred
     * @return a classified FailureKind
     */
    FailureKind classify(String operation, Throwable throwable);

    /**
     * @return true if the throwable is worth another attempt
     */
    default boolean isRetryable(Throwable throwable) {
        return classify("retry-check", throwable).retryable();
    }

    /**
     * Strips the wrappers that {@code CompletableFuture} adds around the real failure.
     */
    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
