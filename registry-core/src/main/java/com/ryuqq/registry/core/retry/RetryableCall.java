package com.ryuqq.registry.core.retry;

/**
 * One attempt of a retryable operation.
 *
 * @param <T> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryableCall<T> {

    /**
     * @param attempt attempt number, starting at 1
     * @return the result
     */
    T call(int attempt);
}
