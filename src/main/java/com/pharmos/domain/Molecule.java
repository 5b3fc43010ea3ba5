package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A chemical compound identified by its canonical SMILES string.
 *
 * Predictions, safety events, trials and papers point at a molecule; the
 * molecule itself only records the projects it belongs to.
 */
public class Molecule extends BaseEntity {

    @JsonProperty("name")
    private String name;

    /**
     * Canonical SMILES notation
     */
    @JsonProperty("smiles")
    private String smiles;

    @JsonProperty("molecular_weight")
    private Double molecularWeight;

    @JsonProperty("log_p")
    private Double logP;

    /**
     * Computed property bag, passed through the JSON scalar
     */
    @JsonProperty("properties")
    private Map<String, Object> properties;

    @JsonProperty("project_ids")
    private List<String> projectIds;

    public Molecule() {
        this.properties = new HashMap<>();
        this.projectIds = new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSmiles() {
        return smiles;
    }

    public void setSmiles(String smiles) {
        this.smiles = smiles;
    }

    public Double getMolecularWeight() {
        return molecularWeight;
    }

    public void setMolecularWeight(Double molecularWeight) {
        this.molecularWeight = molecularWeight;
    }

    public Double getLogP() {
        return logP;
    }

    public void setLogP(Double logP) {
        this.logP = logP;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties;
    }

    public List<String> getProjectIds() {
        return projectIds;
    }

    public void setProjectIds(List<String> projectIds) {
        this.projectIds = projectIds;
    }
}
