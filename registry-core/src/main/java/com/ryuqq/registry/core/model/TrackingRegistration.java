package com.ryuqq.registry.core.model;

/**
 * A tracking subscription registered at the registry.
 *
 * @param trackingId registry-issued tracking id
 * @param entityKey registry key being tracked
 * @param recurrence recurrence expression (e.g. {@code 1 day})
 * @param callbackUrl callback invoked by the registry, may be {@code null}
 * @param status registry-side status ({@code active}, {@code paused}, {@code cancelled})
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TrackingRegistration(
    String trackingId,
    String entityKey,
    String recurrence,
    String callbackUrl,
    String status
) {

    public static final String DEFAULT_RECURRENCE = "1 day";

    public TrackingRegistration {
        if (trackingId == null || trackingId.isBlank()) {
            throw new IllegalArgumentException("trackingId cannot be null or blank");
        }
    }
}
