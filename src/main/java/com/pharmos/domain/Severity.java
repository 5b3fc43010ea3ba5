package com.pharmos.domain;

/**
 * Severity grade of an adverse safety event.
 */
public enum Severity {
    MILD,
    MODERATE,
    SEVERE,
    LIFE_THREATENING,
    FATAL
}
