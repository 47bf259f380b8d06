package com.ryuqq.registry.core.model;

/**
 * A permanent per-entity failure reported in a {@link BatchSummary}.
 *
 * @param entityKey registry key of the failed entity
 * @param message failure description
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EntityError(String entityKey, String message) {
}
