package com.ryuqq.registry.application.runtime;

import com.ryuqq.registry.core.model.BatchSummary;

/**
 * Daily sweep over the monitored population.
 *
 * <p><strong>Run Flow:</strong></p>
 * <pre>
 * runDailyCheck()
 *   ↓
 * 1. Load the active population (failure → run-level crash, failure notification)
 * 2. since = now - lookback
 * 3. Partition into batches of batchSize
 * 4. For each batch:
 *      chunks of `concurrency` entities, dispatched in parallel and joined;
 *      every entity yields exactly one CheckResult
 *    Sleep batchDelay between batches (not after the last one)
 * 5. Aggregate into a BatchSummary, publish it
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>Invoked serially by a periodic trigger; not re-entrant</li>
 *   <li>A call while a run is in flight is rejected</li>
 * </ul>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Per-entity failures are isolated, recorded and counted in {@code failed}</li>
 *   <li>Run-level failures abort the run and are surfaced as a failure notification</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DailyCheck {

    /**
     * Runs one sweep.
     *
     * @return the run summary
     * @throws IllegalStateException if a run is already in flight
     */
    BatchSummary runDailyCheck();

    /**
     * @return whether a run is currently in flight
     */
    boolean isRunning();

    /**
     * Stops dispatching new batches; in-flight checks drain and a partial summary is returned.
     */
    void cancel();
}
