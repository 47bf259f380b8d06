package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.BatchSummary;

/**
 * Delivery of run notifications to operators.
 *
 * <p>Exactly one of the two methods is invoked per run.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NotificationSink {

    /**
     * Publishes the summary of a completed run (even when {@code failed > 0}).
     *
     * @param summary run summary
     */
    void publishSummary(BatchSummary summary);

    /**
     * Publishes a run-level crash.
     *
     * @param error cause of the crash
     */
    void publishFailure(Throwable error);
}
