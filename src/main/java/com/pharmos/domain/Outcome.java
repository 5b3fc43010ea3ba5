package com.pharmos.domain;

/**
 * Patient outcome recorded for a safety event.
 */
public enum Outcome {
    RECOVERED,
    RECOVERING,
    NOT_RECOVERED,
    RECOVERED_WITH_SEQUELAE,
    RESOLVED,
    ONGOING,
    FATAL,
    UNKNOWN
}
