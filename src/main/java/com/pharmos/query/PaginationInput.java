package com.pharmos.query;

/**
 * Uniform pagination arguments accepted by every list query.
 *
 * Values arrive unvalidated from the client; {@link #normalize(int, int)} produces
 * the clamped copy the paginator works with.
 */
public class PaginationInput {

    public static final int DEFAULT_PAGE = 1;
    public static final String DEFAULT_SORT_BY = "createdAt";
    public static final SortOrder DEFAULT_SORT_ORDER = SortOrder.DESC;

    private Integer page;
    private Integer limit;
    private String sortBy;
    private SortOrder sortOrder;

    public PaginationInput() {
    }

    public PaginationInput(Integer page, Integer limit, String sortBy, SortOrder sortOrder) {
        this.page = page;
        this.limit = limit;
        this.sortBy = sortBy;
        this.sortOrder = sortOrder;
    }

    public static PaginationInput of(int page, int limit) {
        return new PaginationInput(page, limit, null, null);
    }

    /**
     * Apply defaults and bounds: page >= 1, 1 <= limit <= maxLimit.
     *
     * @param defaultLimit limit used when none was supplied
     * @param maxLimit upper bound for the limit
     * @return a new, fully populated input
     */
    public PaginationInput normalize(int defaultLimit, int maxLimit) {
        int normalizedPage = page == null || page < 1 ? DEFAULT_PAGE : page;
        int normalizedLimit = limit == null ? defaultLimit : limit;
        normalizedLimit = Math.max(1, Math.min(normalizedLimit, maxLimit));
        String normalizedSortBy = sortBy == null || sortBy.isBlank() ? DEFAULT_SORT_BY : sortBy;
        SortOrder normalizedOrder = sortOrder == null ? DEFAULT_SORT_ORDER : sortOrder;
        return new PaginationInput(normalizedPage, normalizedLimit, normalizedSortBy, normalizedOrder);
    }

    public long getOffset() {
        return (page - 1L) * limit;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public SortOrder getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(SortOrder sortOrder) {
        this.sortOrder = sortOrder;
    }
}
