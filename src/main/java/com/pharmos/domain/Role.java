package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roles a PharmOS user can hold.
 * ADMIN satisfies every role requirement.
 */
public enum Role {

    ADMIN("admin"),

    LEAD_SCIENTIST("lead_scientist"),

    PROJECT_MANAGER("project_manager"),

    CLINICAL_LEAD("clinical_lead"),

    RESEARCHER("researcher");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a string value to Role. Accepts both the wire value ("lead_scientist")
     * and the constant name ("LEAD_SCIENTIST").
     */
    @JsonCreator
    public static Role fromValue(String value) {
        for (Role role : Role.values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown Role value: " + value);
    }
}
