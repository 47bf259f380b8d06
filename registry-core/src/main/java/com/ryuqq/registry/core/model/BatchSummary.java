package com.ryuqq.registry.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated outcome of one daily check run.
 *
 * <p>{@code successful + failed == total} always holds. The {@code errors} list is
 * capped, {@code failed} is not.</p>
 *
 * @param total number of entities processed
 * @param successful number of successful checks
 * @param failed number of permanently failed checks
 * @param withNewData number of entities that reported new items
 * @param withEscalation number of entities whose new items triggered the attachment fetch
 * @param errors per-entity failures, capped
 * @param durationMs wall-clock duration of the run
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BatchSummary(
    int total,
    int successful,
    int failed,
    int withNewData,
    int withEscalation,
    List<EntityError> errors,
    long durationMs
) {

    public static final int DEFAULT_MAX_ERRORS = 100;

    public BatchSummary {
        if (successful + failed != total) {
            throw new IllegalArgumentException(
                "successful + failed must equal total (successful: " + successful
                    + ", failed: " + failed + ", total: " + total + ")"
            );
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Summary of a run with nothing to do, or of a run that crashed before processing.
     */
    public static BatchSummary empty(long durationMs) {
        return new BatchSummary(0, 0, 0, 0, 0, List.of(), durationMs);
    }

    /**
     * @return successful / total as a percentage, 0 for an empty run
     */
    public double successRate() {
        return total == 0 ? 0.0 : successful * 100.0 / total;
    }

    /**
     * @return withEscalation / withNewData as a percentage, 0 when nothing changed
     */
    public double escalationRate() {
        return withNewData == 0 ? 0.0 : withEscalation * 100.0 / withNewData;
    }

    public static Accumulator accumulator() {
        return new Accumulator(DEFAULT_MAX_ERRORS);
    }

    public static Accumulator accumulator(int maxErrors) {
        return new Accumulator(maxErrors);
    }

    /**
     * Running totals of a batch run. Not thread-safe; results are added from the
     * orchestrating thread after each chunk is joined.
     */
    public static final class Accumulator {

        private final int maxErrors;
        private final List<EntityError> errors = new ArrayList<>();
        private int total;
        private int successful;
        private int failed;
        private int withNewData;
        private int withEscalation;

        private Accumulator(int maxErrors) {
            if (maxErrors < 0) {
                throw new IllegalArgumentException("maxErrors cannot be negative (current: " + maxErrors + ")");
            }
            this.maxErrors = maxErrors;
        }

        public Accumulator add(CheckResult result) {
            if (result == null) {
                throw new IllegalArgumentException("result cannot be null");
            }
            total++;
            if (result.success()) {
                successful++;
                if (result.hasNewData()) {
                    withNewData++;
                }
                if (result.escalationRequired()) {
                    withEscalation++;
                }
            } else {
                failed++;
                if (errors.size() < maxErrors) {
                    errors.add(new EntityError(result.entityKey(), result.error()));
                }
            }
            return this;
        }

        public Accumulator addAll(List<CheckResult> results) {
            for (CheckResult result : results) {
                add(result);
            }
            return this;
        }

        public int total() {
            return total;
        }

        public int successful() {
            return successful;
        }

        public int failed() {
            return failed;
        }

        public BatchSummary build(long durationMs) {
            return new BatchSummary(total, successful, failed, withNewData, withEscalation, errors, durationMs);
        }
    }
}
