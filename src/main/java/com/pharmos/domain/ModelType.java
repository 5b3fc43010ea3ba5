package com.pharmos.domain;

/**
 * Prediction model families a molecule can be scored with.
 */
public enum ModelType {
    TOXICITY,
    ADMET,
    EFFICACY,
    BINDING_AFFINITY,
    SOLUBILITY
}
