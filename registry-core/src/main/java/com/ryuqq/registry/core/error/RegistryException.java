package com.ryuqq.registry.core.error;

/**
 * Failure of a registry operation.
 *
 * <p>Carries the {@link ErrorKind}, the retry decision and the optional HTTP status and
 * {@code Retry-After} hint, so nothing downstream has to re-derive them from the message.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RegistryException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;
    private final Integer statusCode;
    private final Long retryAfterMs;

    public RegistryException(ErrorKind kind, String message) {
        this(kind, message, kind == null || kind.isRetryable(), null, null, null);
    }

    public RegistryException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind == null || kind.isRetryable(), null, null, cause);
    }

    public RegistryException(ErrorKind kind, String message, boolean retryable,
                             Integer statusCode, Long retryAfterMs, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (retryAfterMs != null && retryAfterMs < 0) {
            throw new IllegalArgumentException("retryAfterMs cannot be negative (current: " + retryAfterMs + ")");
        }
        this.kind = kind;
        this.retryable = retryable;
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return HTTP status code, {@code null} if the failure happened before a response
     */
    public Integer statusCode() {
        return statusCode;
    }

    /**
     * @return server-supplied delay before the next attempt, {@code null} if absent
     */
    public Long retryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public String toString() {
        return "RegistryException{kind=" + kind
            + (statusCode != null ? ", status=" + statusCode : "")
            + ", retryable=" + retryable
            + ", message=" + getMessage() + '}';
    }
}
