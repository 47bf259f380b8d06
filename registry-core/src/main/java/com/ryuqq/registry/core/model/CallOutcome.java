package com.ryuqq.registry.core.model;

import java.time.Instant;

/**
 * One recorded call result inside a circuit breaker's sliding window.
 *
 * @param timestamp when the call finished
 * @param success whether the call succeeded
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallOutcome(Instant timestamp, boolean success) {

    public CallOutcome {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
