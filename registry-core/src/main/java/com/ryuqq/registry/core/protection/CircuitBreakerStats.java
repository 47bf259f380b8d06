package com.ryuqq.registry.core.protection;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker.
 *
 * @param name logical call group (e.g. {@code tracking-service})
 * @param state current state
 * @param errorRatePercent failures / samples over the current window, as a percentage
 * @param sampleCount outcomes in the current window
 * @param failureCount failures in the current window
 * @param openedAt when the breaker last opened, {@code null} if it never did
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerStats(
    String name,
    CircuitBreakerState state,
    double errorRatePercent,
    int sampleCount,
    int failureCount,
    Instant openedAt
) {
}
