package com.ryuqq.registry.core.model;

/**
 * Outcome of checking one monitored entity in one batch run.
 *
 * <p>Exactly one result is produced per entity per run, success or failure.</p>
 *
 * @param entityId internal entity id
 * @param entityKey registry key, used in error reports
 * @param success whether the check completed
 * @param hasNewData whether the tracking reported new items
 * @param dataCount number of new items
 * @param escalationRequired whether the expensive attachment fetch was triggered
 * @param error failure description, {@code null} on success
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CheckResult(
    String entityId,
    String entityKey,
    boolean success,
    boolean hasNewData,
    int dataCount,
    boolean escalationRequired,
    String error
) {

    public CheckResult {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (dataCount < 0) {
            throw new IllegalArgumentException("dataCount cannot be negative (current: " + dataCount + ")");
        }
        if (!success && (error == null || error.isBlank())) {
            error = "Unknown error";
        }
    }

    public static CheckResult noNewData(MonitoredEntity entity) {
        return new CheckResult(entity.id(), entity.externalKey(), true, false, 0, false, null);
    }

    public static CheckResult updated(MonitoredEntity entity, int dataCount, boolean escalationRequired) {
        return new CheckResult(entity.id(), entity.externalKey(), true, dataCount > 0, dataCount,
            escalationRequired, null);
    }

    public static CheckResult failure(MonitoredEntity entity, String error) {
        return new CheckResult(entity.id(), entity.externalKey(), false, false, 0, false, error);
    }
}
