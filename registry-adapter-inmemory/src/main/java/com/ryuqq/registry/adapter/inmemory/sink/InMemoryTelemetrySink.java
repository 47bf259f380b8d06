package com.ryuqq.registry.adapter.inmemory.sink;

import com.ryuqq.registry.core.model.CallTelemetry;
import com.ryuqq.registry.core.spi.TelemetrySink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link TelemetrySink}.
 *
 * <p>Records every call in arrival order in a {@link CopyOnWriteArrayList}, so iteration
 * during concurrent writes sees a consistent snapshot.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryTelemetrySink implements TelemetrySink {

    private final CopyOnWriteArrayList<CallTelemetry> records = new CopyOnWriteArrayList<>();

    @Override
    public void record(CallTelemetry telemetry) {
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        records.add(telemetry);
    }

    public List<CallTelemetry> records() {
        return List.copyOf(records);
    }

    /**
     * Records of one operation (e.g. {@code "submitSearch"}).
     *
     * @param operation operation name
     * @return matching records in arrival order
     */
    public List<CallTelemetry> recordsOf(String operation) {
        return records.stream()
            .filter(r -> r.operation().equals(operation))
            .collect(Collectors.toList());
    }

    public long failureCount() {
        return records.stream().filter(r -> !r.success()).count();
    }

    /**
     * Sum of the estimated cost of all recorded calls.
     *
     * @return total estimated cost
     */
    public double totalEstimatedCost() {
        return records.stream().mapToDouble(CallTelemetry::estimatedCost).sum();
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
