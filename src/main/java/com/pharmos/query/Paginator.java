package com.pharmos.query;

import com.pharmos.domain.BaseEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns an already-filtered collection into one sorted page.
 *
 * Sorting is single-key with a direction flag. Entities with equal sort keys are
 * ordered by id ascending so that consecutive pages never overlap or skip.
 */
@Component
public class Paginator {
    private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final int defaultLimit;
    private final int maxLimit;

    public Paginator() {
        this(DEFAULT_LIMIT, MAX_LIMIT);
    }

    @Autowired
    public Paginator(
            @Value("${pharmos.pagination.default-limit:20}") int defaultLimit,
            @Value("${pharmos.pagination.max-limit:100}") int maxLimit) {
        if (defaultLimit < 1 || maxLimit < defaultLimit) {
            throw new IllegalStateException(
                "Invalid pagination limits: default=" + defaultLimit + ", max=" + maxLimit);
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Sort and slice a filtered collection.
     *
     * @param filtered entities that already passed the filter
     * @param input raw pagination arguments, may be null
     * @param sortKeys sortable fields of the entity type
     * @return the requested page with metadata computed over {@code filtered}
     * @throws IllegalArgumentException if {@code sortBy} names an unknown field
     */
    public <T extends BaseEntity> Paginated<T> paginate(
            List<T> filtered,
            PaginationInput input,
            Map<String, Comparator<T>> sortKeys) {

        PaginationInput normalized = (input != null ? input : new PaginationInput())
            .normalize(defaultLimit, maxLimit);

        Comparator<T> comparator = sortKeys.get(normalized.getSortBy());
        if (comparator == null) {
            throw new IllegalArgumentException("Cannot sort by '" + normalized.getSortBy()
                + "'; sortable fields are " + sortKeys.keySet());
        }
        if (normalized.getSortOrder() == SortOrder.DESC) {
            comparator = comparator.reversed();
        }
        comparator = comparator.thenComparing(BaseEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

        List<T> sorted = new ArrayList<>(filtered);
        sorted.sort(comparator);

        int total = sorted.size();
        long offset = normalized.getOffset();
        List<T> data = offset >= total
            ? Collections.emptyList()
            : sorted.subList((int) offset, (int) Math.min(offset + normalized.getLimit(), total));

        logger.debug("Paginated {} items: page={}, limit={}, returned={}",
            total, normalized.getPage(), normalized.getLimit(), data.size());

        return new Paginated<>(new ArrayList<>(data),
            new PageInfo(normalized.getPage(), normalized.getLimit(), total));
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
