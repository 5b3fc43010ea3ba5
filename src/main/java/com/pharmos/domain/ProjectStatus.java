package com.pharmos.domain;

/**
 * Lifecycle state of a research project.
 */
public enum ProjectStatus {
    PLANNING,
    ACTIVE,
    ON_HOLD,
    COMPLETED,
    CANCELLED
}
