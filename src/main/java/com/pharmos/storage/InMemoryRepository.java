package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.BaseEntity;
import com.pharmos.query.EntityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Thread-safe in-memory backend for one entity type.
 *
 * Entities are kept in insertion order and copied through Jackson on every read
 * and write. Ids are generated as {@code <prefix>_<n>}.
 *
 * @param <T> entity type
 */
public abstract class InMemoryRepository<T extends BaseEntity> implements EntityRepository<T> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryRepository.class);

    private final Map<String, T> entities = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    private final ObjectMapper objectMapper;
    private final Class<T> entityType;
    private final String idPrefix;

    protected InMemoryRepository(ObjectMapper objectMapper, Class<T> entityType, String idPrefix) {
        this.objectMapper = objectMapper;
        this.entityType = entityType;
        this.idPrefix = idPrefix;
    }

    /**
     * Ids of the parents {@code entity} references through {@code relation}.
     *
     * @throws IllegalArgumentException if the entity type has no such relation
     */
    protected abstract Collection<String> parentIds(T entity, Relation relation);

    protected IllegalArgumentException unsupported(Relation relation) {
        return new IllegalArgumentException(
            entityType.getSimpleName() + " has no " + relation + " relation");
    }

    @Override
    public T findById(String id) {
        if (id == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            T entity = entities.get(id);
            return entity != null ? copy(entity) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<T> findByIds(List<String> ids) {
        lock.readLock().lock();
        try {
            List<T> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                T entity = id != null ? entities.get(id) : null;
                result.add(entity != null ? copy(entity) : null);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<T> findAllByParentId(Relation relation, String parentId) {
        return findAllByParentIds(relation, Collections.singletonList(parentId)).get(parentId);
    }

    @Override
    public Map<String, List<T>> findAllByParentIds(Relation relation, Collection<String> parentIds) {
        Map<String, List<T>> result = new LinkedHashMap<>();
        for (String parentId : parentIds) {
            result.put(parentId, new ArrayList<>());
        }
        lock.readLock().lock();
        try {
            for (T entity : entities.values()) {
                for (String parentId : parentIds(entity, relation)) {
                    List<T> children = result.get(parentId);
                    if (children != null) {
                        children.add(copy(entity));
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    @Override
    public List<T> findAll(EntityFilter<T> filter) {
        EntityFilter<T> predicate = EntityFilter.orAll(filter);
        lock.readLock().lock();
        try {
            List<T> result = new ArrayList<>();
            for (T entity : entities.values()) {
                if (predicate.matches(entity)) {
                    result.add(copy(entity));
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public T create(T entity) {
        T stored = copy(entity);
        Instant now = Instant.now();
        stored.setId(idPrefix + "_" + sequence.incrementAndGet());
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);

        lock.writeLock().lock();
        try {
            entities.put(stored.getId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Created {} {}", entityType.getSimpleName(), stored.getId());
        return copy(stored);
    }

    @Override
    public T update(String id, Consumer<T> changes) {
        lock.writeLock().lock();
        try {
            T existing = entities.get(id);
            if (existing == null) {
                return null;
            }
            T updated = copy(existing);
            changes.accept(updated);
            updated.setId(existing.getId());
            updated.setCreatedAt(existing.getCreatedAt());
            updated.setUpdatedAt(Instant.now());
            entities.put(id, updated);
            logger.debug("Updated {} {}", entityType.getSimpleName(), id);
            return copy(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            boolean removed = entities.remove(id) != null;
            if (removed) {
                logger.debug("Deleted {} {}", entityType.getSimpleName(), id);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return entities.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Load pre-built entities, keeping their ids and timestamps. Entities without
     * an id are assigned one. The id sequence continues past the largest seeded
     * {@code <prefix>_<n>} id.
     */
    public void seed(List<T> seedEntities) {
        lock.writeLock().lock();
        try {
            for (T entity : seedEntities) {
                T stored = copy(entity);
                if (stored.getId() == null) {
                    stored.setId(idPrefix + "_" + sequence.incrementAndGet());
                } else {
                    advanceSequencePast(stored.getId());
                }
                if (stored.getCreatedAt() == null) {
                    stored.setCreatedAt(Instant.now());
                }
                if (stored.getUpdatedAt() == null) {
                    stored.setUpdatedAt(stored.getCreatedAt());
                }
                entities.put(stored.getId(), stored);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Seeded {} {} entities", seedEntities.size(), entityType.getSimpleName());
    }

    public Class<T> getEntityType() {
        return entityType;
    }

    private void advanceSequencePast(String id) {
        String prefix = idPrefix + "_";
        if (!id.startsWith(prefix)) {
            return;
        }
        try {
            long n = Long.parseLong(id.substring(prefix.length()));
            sequence.accumulateAndGet(n, Math::max);
        } catch (NumberFormatException e) {
            logger.debug("Seed id {} has no numeric suffix, sequence unchanged", id);
        }
    }

    private T copy(T entity) {
        return objectMapper.convertValue(entity, entityType);
    }
}
