package org.javai.gateway.failure;

/**
 * The gateway's error taxonomy. Every failure observed on a gateway call resolves to exactly one
 * class, and the class alone decides whether the call is retried, whether it counts against the
 * circuit breaker and whether a fallback may be served.
 */
public enum FailureClass {

    /** Connection refused or reset, DNS failure, timeout. */
    TRANSIENT_NETWORK(true, true, true, true),

    /** HTTP 429. */
    RATE_LIMITED(true, true, true, true),

    /** HTTP 5xx. */
    DOWNSTREAM_SERVER(true, true, true, true),

    /** Any other HTTP 4xx. The request itself is wrong, so retrying cannot help. */
    DOWNSTREAM_CLIENT(false, false, true, false),

    /** Rejected by an open circuit breaker without reaching the downstream service. */
    BREAKER_OPEN(false, false, true, true),

    /** The downstream answered, but the response failed validation. */
    INVALID_RESPONSE(false, true, true, true),

    /** The overall deadline across all attempts elapsed. */
    DEADLINE_EXCEEDED(false, true, true, true),

    /** A required field of the internal record is missing or invalid. A caller bug. */
    MAPPING(false, false, false, false),

    /** The caller aborted the call. */
    CANCELLED(false, false, false, false),

    /** Anything the classifier does not recognise. */
    UNKNOWN(false, true, true, false);

    private final boolean retryable;
    private final boolean tripsBreaker;
    private final boolean fallbackEligible;
    private final boolean recoverable;

    FailureClass(boolean retryable, boolean tripsBreaker, boolean fallbackEligible, boolean recoverable) {
        this.retryable = retryable;
        this.tripsBreaker = tripsBreaker;
        this.fallbackEligible = fallbackEligible;
        this.recoverable = recoverable;
    }

    /**
     * @return true if another attempt may succeed
     */
    public boolean retryable() {
        return retryable;
    }

    /**
     * @return true if this failure counts toward opening a circuit breaker
     */
    public boolean tripsBreaker() {
        return tripsBreaker;
    }

    /**
     * @return true if a registered fallback entry may be served in place of this failure
     */
    public boolean fallbackEligible() {
        return fallbackEligible;
    }

    /**
     * Whether a generic "no fallback configured" entry may stand in for this failure when the
     * category has no registered fallback. Non-recoverable failures are surfaced instead.
     *
     * @return true if the failure is recoverable without a registered fallback
     */
    public boolean recoverable() {
        return recoverable;
    }
}
