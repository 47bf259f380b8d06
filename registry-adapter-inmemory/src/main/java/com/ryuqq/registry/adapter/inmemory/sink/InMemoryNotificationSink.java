package com.ryuqq.registry.adapter.inmemory.sink;

import com.ryuqq.registry.core.model.BatchSummary;
import com.ryuqq.registry.core.spi.NotificationSink;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link NotificationSink}.
 *
 * <p>Keeps published run summaries and run-level failures separately so tests can assert
 * which path a daily check took.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryNotificationSink implements NotificationSink {

    private final CopyOnWriteArrayList<BatchSummary> summaries = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Throwable> failures = new CopyOnWriteArrayList<>();

    @Override
    public void publishSummary(BatchSummary summary) {
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
        summaries.add(summary);
    }

    @Override
    public void publishFailure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        failures.add(error);
    }

    public List<BatchSummary> summaries() {
        return List.copyOf(summaries);
    }

    public List<Throwable> failures() {
        return List.copyOf(failures);
    }

    /**
     * Most recently published summary.
     *
     * @return last summary, empty if none was published
     */
    public Optional<BatchSummary> lastSummary() {
        if (summaries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(summaries.get(summaries.size() - 1));
    }

    public void clear() {
        summaries.clear();
        failures.clear();
    }
}
