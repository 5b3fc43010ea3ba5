package com.pharmos.query;

/**
 * Predicate over one entity type. Every filter input implements this; unset
 * fields match everything and set fields are combined with AND.
 *
 * @param <T> entity type
 */
@FunctionalInterface
public interface EntityFilter<T> {

    boolean matches(T entity);

    static <T> EntityFilter<T> all() {
        return entity -> true;
    }

    /**
     * @return the filter, or a filter accepting everything when {@code filter} is null
     */
    static <T> EntityFilter<T> orAll(EntityFilter<T> filter) {
        return filter != null ? filter : all();
    }
}
