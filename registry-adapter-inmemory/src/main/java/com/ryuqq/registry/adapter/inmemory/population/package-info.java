/**
 * In-memory {@link com.ryuqq.registry.core.spi.PopulationSource} adapter.
 *
 * <p>Holds the set of monitored entities for tests and local runs. Entities can be
 * enabled, disabled and removed at runtime, and a listing failure can be injected to
 * exercise the run-level crash path of the daily check.</p>
 *
 * @see com.ryuqq.registry.adapter.inmemory.population.InMemoryPopulationSource
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.population;
