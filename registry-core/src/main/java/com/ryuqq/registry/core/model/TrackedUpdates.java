package com.ryuqq.registry.core.model;

import java.util.List;

/**
 * New items of a tracking subscription since a given timestamp.
 *
 * @param trackingId tracking subscription id
 * @param items new items, empty when nothing changed
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TrackedUpdates(String trackingId, List<TrackedItem> items) {

    public TrackedUpdates {
        if (trackingId == null || trackingId.isBlank()) {
            throw new IllegalArgumentException("trackingId cannot be null or blank");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static TrackedUpdates none(String trackingId) {
        return new TrackedUpdates(trackingId, List.of());
    }

    public boolean hasNewData() {
        return !items.isEmpty();
    }

    public int count() {
        return items.size();
    }
}
