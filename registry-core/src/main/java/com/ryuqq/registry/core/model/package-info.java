/**
 * Domain model of the registry subsystem.
 *
 * <p>All types are immutable records except {@link com.ryuqq.registry.core.model.BatchSummary.Accumulator}.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.MonitoredEntity} - record under monitoring (read-only input)</li>
 *   <li>{@link com.ryuqq.registry.core.model.RegistryJob} - asynchronous search at the registry</li>
 *   <li>{@link com.ryuqq.registry.core.model.TrackedUpdates} - new items of a tracking subscription</li>
 *   <li>{@link com.ryuqq.registry.core.model.CheckResult} - per-entity outcome of a run</li>
 *   <li>{@link com.ryuqq.registry.core.model.BatchSummary} - aggregated outcome of a run</li>
 *   <li>{@link com.ryuqq.registry.core.model.CallTelemetry} - per-call telemetry record</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.core.model;
