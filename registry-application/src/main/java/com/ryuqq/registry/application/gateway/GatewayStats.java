package com.ryuqq.registry.application.gateway;

import com.ryuqq.registry.core.protection.CircuitBreakerStats;

import java.util.Map;

/**
 * Snapshot of gateway statistics.
 *
 * @param totalCalls calls started
 * @param successfulCalls calls that returned a result
 * @param failedCalls calls that ended in an error (including circuit-open rejections)
 * @param rateLimitHits 429 responses received, counting every attempt
 * @param averageResponseTimeMs running average latency of successful calls
 * @param lastError message of the most recent failure, {@code null} if none
 * @param circuits state of each circuit breaker by name
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GatewayStats(
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long rateLimitHits,
    double averageResponseTimeMs,
    String lastError,
    Map<String, CircuitBreakerStats> circuits
) {

    public GatewayStats {
        circuits = circuits == null ? Map.of() : Map.copyOf(circuits);
    }
}
