package com.pharmos.query;

/**
 * Sort direction for list queries.
 */
public enum SortOrder {
    ASC,
    DESC
}
