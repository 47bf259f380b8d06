/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the registry core depends on but does not implement.
 * The surrounding application provides them; {@code registry-adapter-inmemory} provides
 * in-memory versions for tests and local runs.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.spi.PopulationSource} - reads the monitored population</li>
 *   <li>{@link com.ryuqq.registry.core.spi.ResultSink} - persists new items and attachments</li>
 *   <li>{@link com.ryuqq.registry.core.spi.TelemetrySink} - best-effort per-call telemetry</li>
 *   <li>{@link com.ryuqq.registry.core.spi.NotificationSink} - run summary / failure notification</li>
 *   <li>{@link com.ryuqq.registry.core.spi.Sleeper} - blocking pause</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registry.core.spi;
