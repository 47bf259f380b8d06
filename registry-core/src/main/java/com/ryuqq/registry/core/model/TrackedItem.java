package com.ryuqq.registry.core.model;

/**
 * One new item (a docket movement) reported by a tracking subscription.
 *
 * @param itemId registry id of the item, may be {@code null}
 * @param text human readable text of the item, may be {@code null}
 * @param rawJson the item exactly as the registry returned it
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TrackedItem(String itemId, String text, String rawJson) {

    public TrackedItem {
        if (rawJson == null) {
            throw new IllegalArgumentException("rawJson cannot be null");
        }
    }

    /**
     * @return true if the item carries usable text
     */
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
