package com.ryuqq.registry.adapter.inmemory.sink;

import com.ryuqq.registry.core.model.AttachmentRef;
import com.ryuqq.registry.core.model.TrackedItem;
import com.ryuqq.registry.core.spi.ResultSink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ResultSink} for testing and local runs.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>updates:</strong> ConcurrentHashMap&lt;entityId, CopyOnWriteArrayList&lt;TrackedItem&gt;&gt; - items in arrival order</li>
 *   <li><strong>attachments:</strong> ConcurrentHashMap&lt;entityId, CopyOnWriteArrayList&lt;StoredAttachment&gt;&gt; - downloaded documents</li>
 * </ul>
 *
 * <p>Repeated deliveries of the same item are appended, not merged: an entity check that is
 * retried after a partial success may persist the same update twice.</p>
 *
 * <p><strong>Failure Injection:</strong> {@link #failUpdates(RuntimeException, int)} makes the
 * next N {@link #persistUpdate} calls throw, so callers can exercise their retry path.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResultSink implements ResultSink {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<TrackedItem>> updates;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<StoredAttachment>> attachments;
    private final AtomicReference<RuntimeException> updateFailure;
    private final AtomicInteger remainingUpdateFailures;

    /**
     * Creates an empty sink.
     */
    public InMemoryResultSink() {
        this.updates = new ConcurrentHashMap<>();
        this.attachments = new ConcurrentHashMap<>();
        this.updateFailure = new AtomicReference<>();
        this.remainingUpdateFailures = new AtomicInteger();
    }

    @Override
    public void persistUpdate(String entityId, List<TrackedItem> items) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (remainingUpdateFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw updateFailure.get();
        }
        updates.computeIfAbsent(entityId, id -> new CopyOnWriteArrayList<>()).addAll(items);
    }

    @Override
    public void persistAttachment(String entityId, AttachmentRef attachment, byte[] content) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (attachment == null) {
            throw new IllegalArgumentException("attachment cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        attachments.computeIfAbsent(entityId, id -> new CopyOnWriteArrayList<>())
            .add(new StoredAttachment(attachment, content.clone()));
    }

    /**
     * Makes the next {@code times} calls to {@link #persistUpdate} throw {@code failure}.
     *
     * @param failure exception to throw
     * @param times number of failing calls
     */
    public void failUpdates(RuntimeException failure, int times) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        updateFailure.set(failure);
        remainingUpdateFailures.set(times);
    }

    /**
     * Items persisted for an entity, in arrival order.
     *
     * @param entityId entity id
     * @return persisted items (empty if none)
     */
    public List<TrackedItem> updatesOf(String entityId) {
        List<TrackedItem> items = updates.get(entityId);
        return items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Attachments persisted for an entity, in arrival order.
     *
     * @param entityId entity id
     * @return stored attachments (empty if none)
     */
    public List<StoredAttachment> attachmentsOf(String entityId) {
        List<StoredAttachment> stored = attachments.get(entityId);
        return stored == null ? List.of() : List.copyOf(stored);
    }

    /**
     * Entity ids that received at least one update.
     *
     * @return entity ids
     */
    public List<String> updatedEntityIds() {
        return new ArrayList<>(updates.keySet());
    }

    public int totalUpdates() {
        return updates.values().stream().mapToInt(List::size).sum();
    }

    public int totalAttachments() {
        return attachments.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Clears all stored data and pending failures.
     */
    public void clear() {
        updates.clear();
        attachments.clear();
        remainingUpdateFailures.set(0);
        updateFailure.set(null);
    }

    /**
     * A downloaded attachment as stored by the sink.
     *
     * @param ref attachment metadata
     * @param content attachment bytes
     */
    public record StoredAttachment(AttachmentRef ref, byte[] content) {

        public StoredAttachment {
            if (ref == null) {
                throw new IllegalArgumentException("ref cannot be null");
            }
            if (content == null) {
                throw new IllegalArgumentException("content cannot be null");
            }
        }

        public int size() {
            return content.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StoredAttachment)) {
                return false;
            }
            StoredAttachment that = (StoredAttachment) o;
            return ref.equals(that.ref) && Arrays.equals(content, that.content);
        }

        @Override
        public int hashCode() {
            return 31 * ref.hashCode() + Arrays.hashCode(content);
        }

        @Override
        public String toString() {
            return "StoredAttachment{ref=" + ref + ", size=" + content.length + "}";
        }
    }
}
