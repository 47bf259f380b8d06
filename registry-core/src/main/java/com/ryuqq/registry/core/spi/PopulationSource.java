package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.MonitoredEntity;

import java.util.List;

/**
 * Source of the monitored population.
 *
 * <p>Implemented by the persistence layer of the surrounding application.
 * A failure here is a run-level failure: the daily check aborts and publishes a
 * failure notification.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PopulationSource {

    /**
     * Lists every entity with monitoring enabled.
     *
     * @return active entities, empty when nothing is monitored
     */
    List<MonitoredEntity> listActive();
}
