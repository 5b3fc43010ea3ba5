package com.pharmos.domain;

/**
 * Recruitment/progress status of a clinical trial.
 */
public enum TrialStatus {
    NOT_YET_RECRUITING,
    RECRUITING,
    ACTIVE,
    COMPLETED,
    SUSPENDED,
    TERMINATED,
    WITHDRAWN
}
