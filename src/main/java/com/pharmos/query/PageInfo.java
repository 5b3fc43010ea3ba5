package com.pharmos.query;

/**
 * Page metadata returned next to every page of results. {@code total} counts the
 * filtered set, not the raw collection.
 */
public class PageInfo {

    private final int page;
    private final int limit;
    private final int total;
    private final int totalPages;
    private final boolean hasNextPage;
    private final boolean hasPreviousPage;

    public PageInfo(int page, int limit, int total) {
        this.page = page;
        this.limit = limit;
        this.total = total;
        this.totalPages = (int) Math.ceil((double) total / limit);
        this.hasNextPage = (long) (page - 1) * limit + limit < total;
        this.hasPreviousPage = page > 1;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public int getTotal() {
        return total;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean isHasNextPage() {
        return hasNextPage;
    }

    public boolean isHasPreviousPage() {
        return hasPreviousPage;
    }
}
