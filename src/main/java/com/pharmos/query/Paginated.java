package com.pharmos.query;

import java.util.List;

/**
 * One page of results. Backs every {@code *Page} type in the schema.
 *
 * @param <T> entity type
 */
public class Paginated<T> {

    private final List<T> data;
    private final PageInfo pagination;

    public Paginated(List<T> data, PageInfo pagination) {
        this.data = data;
        this.pagination = pagination;
    }

    public List<T> getData() {
        return data;
    }

    public PageInfo getPagination() {
        return pagination;
    }
}
