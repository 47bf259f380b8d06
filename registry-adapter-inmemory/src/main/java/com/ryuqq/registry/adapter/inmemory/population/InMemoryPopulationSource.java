package com.ryuqq.registry.adapter.inmemory.population;

import com.ryuqq.registry.core.model.MonitoredEntity;
import com.ryuqq.registry.core.spi.PopulationSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link PopulationSource} for testing and local runs.
 *
 * <p>Entities are kept in registration order inside a {@link ConcurrentHashMap} keyed by
 * entity id. Disabled entities stay registered but are excluded from {@link #listActive()}.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li><strong>Enable/Disable:</strong> toggles monitoring without losing the entity</li>
 *   <li><strong>Failure Injection:</strong> {@link #failWith(RuntimeException)} makes the next
 *       listing throw, simulating an unavailable database</li>
 *   <li><strong>Thread Safety:</strong> all operations are safe for concurrent use</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryPopulationSource implements PopulationSource {

    /**
     * Registered entities with their monitoring flag.
     * Key: entity id, Value: Registration (entity, enabled, sequence)
     */
    private final ConcurrentHashMap<String, Registration> entities;

    private final AtomicReference<RuntimeException> pendingFailure;

    private long sequence;

    /**
     * Creates an empty source.
     */
    public InMemoryPopulationSource() {
        this.entities = new ConcurrentHashMap<>();
        this.pendingFailure = new AtomicReference<>();
    }

    /**
     * Creates a source with the given entities, all enabled.
     *
     * @param initial initial entities
     */
    public InMemoryPopulationSource(Collection<MonitoredEntity> initial) {
        this();
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        initial.forEach(this::add);
    }

    /**
     * Registers (or replaces) an entity with monitoring enabled.
     *
     * @param entity entity to register
     */
    public synchronized void add(MonitoredEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        Registration existing = entities.get(entity.id());
        long order = existing != null ? existing.sequence : sequence++;
        entities.put(entity.id(), new Registration(entity, true, order));
    }

    /**
     * Turns monitoring on or off for an entity.
     *
     * @param entityId entity id
     * @param enabled new monitoring flag
     * @return {@code true} if the entity exists
     */
    public boolean setEnabled(String entityId, boolean enabled) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        Registration updated = entities.computeIfPresent(entityId,
            (id, current) -> new Registration(current.entity, enabled, current.sequence));
        return updated != null;
    }

    /**
     * Removes an entity.
     *
     * @param entityId entity id
     * @return removed entity, if any
     */
    public Optional<MonitoredEntity> remove(String entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        return Optional.ofNullable(entities.remove(entityId)).map(r -> r.entity);
    }

    /**
     * Makes the next {@link #listActive()} call throw the given exception.
     *
     * @param failure exception to throw once
     */
    public void failWith(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        pendingFailure.set(failure);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns enabled entities in registration order.</p>
     */
    @Override
    public List<MonitoredEntity> listActive() {
        RuntimeException failure = pendingFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        List<Registration> snapshot = new ArrayList<>(entities.values());
        snapshot.sort((a, b) -> Long.compare(a.sequence, b.sequence));

        List<MonitoredEntity> active = new ArrayList<>(snapshot.size());
        for (Registration registration : snapshot) {
            if (registration.enabled) {
                active.add(registration.entity);
            }
        }
        return List.copyOf(active);
    }

    /**
     * Total registered entities (enabled or not).
     *
     * @return entity count
     */
    public int size() {
        return entities.size();
    }

    /**
     * Clears all entities.
     */
    public void clear() {
        entities.clear();
        pendingFailure.set(null);
    }

    /**
     * Read-only view of the registered entities keyed by id.
     *
     * @return entity map snapshot
     */
    public Map<String, MonitoredEntity> snapshot() {
        Map<String, MonitoredEntity> copy = new ConcurrentHashMap<>();
        entities.forEach((id, registration) -> copy.put(id, registration.entity));
        return Map.copyOf(copy);
    }

    private static final class Registration {
        private final MonitoredEntity entity;
        private final boolean enabled;
        private final long sequence;

        private Registration(MonitoredEntity entity, boolean enabled, long sequence) {
            this.entity = entity;
            this.enabled = enabled;
            this.sequence = sequence;
        }
    }
}
