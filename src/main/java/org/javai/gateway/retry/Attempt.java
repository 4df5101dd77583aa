package org.javai.gateway.retry;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed attempt of a retried call. Lives only for the duration of the call.
 *
 * @param index 0-based attempt index; the first call is 0, the first retry is 1
 * @param startedAt when the attempt was started
 * @param error the error the attempt failed with, or null if it succeeded
 */
public record Attempt(int index, Instant startedAt, Throwable error) {

    public Attempt {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    /**
     * @return the 1-based attempt number used in logs and reports
     */
    public int number() {
        return index + 1;
    }

    public boolean failed() {
        return error != null;
    }
}
