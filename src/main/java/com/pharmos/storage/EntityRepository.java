package com.pharmos.storage;

import com.pharmos.domain.BaseEntity;
import com.pharmos.query.EntityFilter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Storage contract the GraphQL layer depends on, one instance per entity type.
 *
 * Implementations own id assignment and timestamps. Returned entities are
 * detached copies: mutating them never changes stored state.
 *
 * @param <T> entity type
 */
public interface EntityRepository<T extends BaseEntity> {

    /**
     * @return the entity, or null if no entity has this id
     */
    T findById(String id);

    /**
     * Batch lookup by id.
     *
     * @param ids ids to fetch, possibly with duplicates
     * @return one element per input id in the same order, null where the id is unknown
     */
    List<T> findByIds(List<String> ids);

    /**
     * @return entities whose {@code relation} reference includes {@code parentId}; empty if none
     */
    List<T> findAllByParentId(Relation relation, String parentId);

    /**
     * Batch lookup by parent reference.
     *
     * @return a map holding every requested parent id, mapped to an empty list when nothing references it
     * @throws IllegalArgumentException if this entity type has no such relation
     */
    Map<String, List<T>> findAllByParentIds(Relation relation, Collection<String> parentIds);

    List<T> findAll(EntityFilter<T> filter);

    /**
     * Store a new entity. Any id or timestamps on the argument are replaced.
     *
     * @return the stored entity with its assigned id
     */
    T create(T entity);

    /**
     * Merge-style update: {@code changes} is applied to a copy of the stored entity.
     *
     * @return the updated entity, or null if no entity has this id
     */
    T update(String id, Consumer<T> changes);

    /**
     * @return true if an entity was removed
     */
    boolean delete(String id);

    int count();
}
