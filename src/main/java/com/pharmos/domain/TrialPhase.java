package com.pharmos.domain;

/**
 * Clinical trial phase.
 */
public enum TrialPhase {
    PHASE_1,
    PHASE_2,
    PHASE_3,
    PHASE_4
}
