package com.ryuqq.registry.core.model;

import java.time.Instant;

/**
 * A registry record under daily monitoring.
 *
 * <p>Supplied by the population source and read-only to the core.</p>
 *
 * @param id internal identifier used when persisting results
 * @param externalKey registry key of the record (a CNJ lawsuit number)
 * @param trackingId registry-issued tracking subscription id
 * @param lastCheckedAt last successful check, {@code null} if never checked
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MonitoredEntity(
    String id,
    String externalKey,
    String trackingId,
    Instant lastCheckedAt
) {

    public MonitoredEntity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (externalKey == null || externalKey.isBlank()) {
            throw new IllegalArgumentException("externalKey cannot be null or blank");
        }
        if (trackingId == null || trackingId.isBlank()) {
            throw new IllegalArgumentException("trackingId cannot be null or blank");
        }
    }

    /**
     * Creates an entity that was never checked.
     *
     * @param id internal identifier
     * @param externalKey registry key
     * @param trackingId tracking subscription id
     * @return a new entity
     */
    public static MonitoredEntity of(String id, String externalKey, String trackingId) {
        return new MonitoredEntity(id, externalKey, trackingId, null);
    }
}
