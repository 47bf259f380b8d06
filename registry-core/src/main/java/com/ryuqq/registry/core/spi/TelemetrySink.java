package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.CallTelemetry;

/**
 * Best-effort telemetry of gateway calls.
 *
 * <p>Invoked off the critical path. Exceptions thrown here are logged and dropped;
 * they never fail the underlying call.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TelemetrySink {

    void record(CallTelemetry telemetry);
}
