package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.core.model.BatchSummary;

/**
 * Run-level failure of a daily check (e.g. the population source is unreachable).
 *
 * <p>Per-entity failures never surface as this exception; they are counted in the summary.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BatchRunException extends RuntimeException {

    private final BatchSummary summary;

    public BatchRunException(String message, Throwable cause, BatchSummary summary) {
        super(message, cause);
        this.summary = summary == null ? BatchSummary.empty(0) : summary;
    }

    /**
     * @return zeroed statistics of the aborted run
     */
    public BatchSummary summary() {
        return summary;
    }
}
