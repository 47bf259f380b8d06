package com.ryuqq.registry.core.retry;

import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps HTTP statuses and transport exceptions onto {@link RegistryException}.
 *
 * <p>Status classification:</p>
 * <ul>
 *   <li>429, 500, 502, 503, 504: retryable</li>
 *   <li>400, 401, 403, 404: terminal</li>
 *   <li>anything else: retryable only if {@code >= 500}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final Set<Integer> TERMINAL_STATUSES = Set.of(400, 401, 403, 404);

    private FailureClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isRetryableStatus(int status) {
        if (RETRYABLE_STATUSES.contains(status)) {
            return true;
        }
        if (TERMINAL_STATUSES.contains(status)) {
            return false;
        }
        return status >= 500;
    }

    /**
     * Classifies a non-2xx response.
     *
     * @param status HTTP status
     * @param message description (usually a body excerpt)
     * @param retryAfterMs parsed {@code Retry-After} hint, may be {@code null}
     * @return the classified exception (not thrown)
     */
    public static RegistryException fromStatus(int status, String message, Long retryAfterMs) {
        ErrorKind kind = kindOf(status);
        String text = "Registry responded " + status + (message == null || message.isBlank() ? "" : ": " + message);
        return new RegistryException(kind, text, isRetryableStatus(status), status, retryAfterMs, null);
    }

    /**
     * Classifies an exception thrown before or while reading a response.
     *
     * <p>A {@link RegistryException} is returned as-is.</p>
     *
     * @param throwable the failure
     * @return the classified exception (not thrown)
     */
    public static RegistryException fromThrowable(Throwable throwable) {
        if (throwable instanceof RegistryException registryException) {
            return registryException;
        }
        if (throwable instanceof UncheckedIOException unchecked) {
            return fromThrowable(unchecked.getCause());
        }
        if (throwable instanceof SocketTimeoutException || throwable instanceof TimeoutException) {
            return new RegistryException(ErrorKind.TIMEOUT, "Request timed out: " + throwable.getMessage(), throwable);
        }
        if (throwable instanceof IOException) {
            return new RegistryException(ErrorKind.NETWORK, "Network failure: " + throwable.getMessage(), throwable);
        }
        String message = throwable == null ? "unknown" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
        return new RegistryException(ErrorKind.UNEXPECTED, message, throwable);
    }

    /**
     * Parses a {@code Retry-After} header given in seconds.
     *
     * @param header header value, may be {@code null}
     * @return milliseconds, or {@code null} if absent or not a number of seconds
     */
    public static Long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : seconds * 1000L;
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the registry
            return null;
        }
    }

    private static ErrorKind kindOf(int status) {
        if (status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return ErrorKind.AUTH;
        }
        if (status == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (status == 503) {
            return ErrorKind.SERVER_OVERLOAD;
        }
        if (status >= 500) {
            return ErrorKind.SERVER;
        }
        return ErrorKind.CLIENT;
    }
}
