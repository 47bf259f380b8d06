package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.AttachmentRef;
import com.ryuqq.registry.core.model.TrackedItem;

import java.util.List;

/**
 * Persistence of check results.
 *
 * <p>Delivery is at-least-once: an entity-level retry may persist the same items
 * again, so implementations should upsert by item id.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResultSink {

    /**
     * Stores new items of an entity.
     *
     * @param entityId internal entity id
     * @param items new items (never empty)
     */
    void persistUpdate(String entityId, List<TrackedItem> items);

    /**
     * Stores a downloaded attachment.
     *
     * @param entityId internal entity id
     * @param attachment attachment metadata
     * @param content attachment bytes
     */
    void persistAttachment(String entityId, AttachmentRef attachment, byte[] content);
}
