package com.ryuqq.registry.application.escalation;

import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.MonitoredEntity;

/**
 * The expensive secondary fetch: retrieves and stores the attachments of an entity.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AttachmentFetcher {

    /**
     * Fetches and persists the current attachments of an entity.
     *
     * @param entity the entity whose new items triggered escalation
     * @return number of attachments stored
     * @throws RegistryException if the search job fails or times out
     */
    int fetch(MonitoredEntity entity);
}
