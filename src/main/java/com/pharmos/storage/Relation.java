package com.pharmos.storage;

/**
 * Kinds of parent key an entity can be looked up by in
 * {@link EntityRepository#findAllByParentIds}.
 */
public enum Relation {
    USER,
    PROJECT,
    MOLECULE,
    CLINICAL_TRIAL,
    RESEARCH_PAPER
}
