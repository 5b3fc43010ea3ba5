package com.pharmos.domain;

/**
 * Kind of work a project carries out.
 */
public enum ProjectType {
    DRUG_DISCOVERY,
    CLINICAL_DEVELOPMENT,
    RESEARCH,
    REGULATORY
}
