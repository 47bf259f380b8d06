package com.ryuqq.registry.core.error;

/**
 * Classification of a registry failure.
 *
 * <p>Decided once at the HTTP boundary and carried through the call chain.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 400 or any other 4xx that is not listed below. */
    CLIENT(false),

    /** 401 / 403. */
    AUTH(false),

    /** 404. */
    NOT_FOUND(false),

    /** 429, honors {@code Retry-After}. */
    RATE_LIMITED(true),

    /** 500, 502, 504 and any other 5xx. */
    SERVER(true),

    /** 503. */
    SERVER_OVERLOAD(true),

    /** Request timed out before a response arrived. */
    TIMEOUT(true),

    /** Connection refused, reset or any other I/O failure. */
    NETWORK(true),

    /** Circuit breaker rejected the call without attempting it. */
    CIRCUIT_OPEN(false),

    /** The asynchronous job itself reported failure. */
    JOB_FAILED(false),

    /** The job did not finish within the polling budget. */
    JOB_TIMEOUT(false),

    /** Declared attachment size exceeds the configured bound. */
    ATTACHMENT_TOO_LARGE(false),

    /** Response body could not be parsed. */
    PARSE(false),

    /** Anything else, usually a programming error. */
    UNEXPECTED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return whether failures of this kind are retried by default
     */
    public boolean isRetryable() {
        return retryable;
    }
}
