package com.pharmos.graphql.input;

import com.pharmos.domain.Molecule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.pharmos.graphql.input.Inputs.copyOf;
import static com.pharmos.graphql.input.Inputs.requireNonNegative;
import static com.pharmos.graphql.input.Inputs.requireText;
import static com.pharmos.graphql.input.Inputs.setIfPresent;
import static com.pharmos.graphql.input.Inputs.validateSmiles;

/**
 * Molecule fields accepted by create and update mutations.
 */
public class MoleculeInput {

    private String name;
    private String smiles;
    private Double molecularWeight;
    private Double logP;
    private Map<String, Object> properties;
    private List<String> projectIds;

    public MoleculeInput() {
    }

    public MoleculeInput(String name, String smiles) {
        this.name = name;
        this.smiles = smiles;
    }

    /**
     * Checks for creation: name and a well-formed SMILES are required.
     */
    public void validateForCreate() {
        requireText(name, "name");
        requireText(smiles, "smiles");
        validateForUpdate();
    }

    public void validateForUpdate() {
        if (name != null) {
            requireText(name, "name");
        }
        validateSmiles(smiles != null ? smiles.trim() : null);
        requireNonNegative(molecularWeight, "molecularWeight");
    }

    public Molecule toEntity() {
        Molecule molecule = new Molecule();
        molecule.setName(name.trim());
        molecule.setSmiles(smiles.trim());
        molecule.setMolecularWeight(molecularWeight);
        molecule.setLogP(logP);
        molecule.setProperties(properties != null ? new HashMap<>(properties) : new HashMap<>());
        molecule.setProjectIds(copyOf(projectIds));
        return molecule;
    }

    /**
     * Merge the set fields into {@code molecule}; unset fields stay unchanged.
     */
    public void applyTo(Molecule molecule) {
        setIfPresent(name != null ? name.trim() : null, molecule::setName);
        setIfPresent(smiles != null ? smiles.trim() : null, molecule::setSmiles);
        setIfPresent(molecularWeight, molecule::setMolecularWeight);
        setIfPresent(logP, molecule::setLogP);
        setIfPresent(properties, value -> molecule.setProperties(new HashMap<>(value)));
        setIfPresent(projectIds, value -> molecule.setProjectIds(copyOf(value)));
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
