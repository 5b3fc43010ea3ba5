package com.pharmos.query;

import com.pharmos.domain.Molecule;

import java.time.Instant;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;
import static com.pharmos.query.Predicates.inRange;
import static com.pharmos.query.Predicates.memberIfSet;

/**
 * Filter input for molecule list queries.
 */
public class MoleculeFilter implements EntityFilter<Molecule> {

    private String name;
    private String smiles;
    private String projectId;
    private Double minMolecularWeight;
    private Double maxMolecularWeight;
    private Double minLogP;
    private Double maxLogP;
    private Instant createdAfter;
    private Instant createdBefore;

    @Override
    public boolean matches(Molecule molecule) {
        return containsIfSet(name, molecule.getName())
            && equalsIfSet(smiles, molecule.getSmiles())
            && memberIfSet(projectId, molecule.getProjectIds())
            && inRange(molecule.getMolecularWeight(), minMolecularWeight, maxMolecularWeight)
            && inRange(molecule.getLogP(), minLogP, maxLogP)
            && inRange(molecule.getCreatedAt(), createdAfter, createdBefore);
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

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Double getMinMolecularWeight() {
        return minMolecularWeight;
    }

    public void setMinMolecularWeight(Double minMolecularWeight) {
        this.minMolecularWeight = minMolecularWeight;
    }

    public Double getMaxMolecularWeight() {
        return maxMolecularWeight;
    }

    public void setMaxMolecularWeight(Double maxMolecularWeight) {
        this.maxMolecularWeight = maxMolecularWeight;
    }

    public Double getMinLogP() {
        return minLogP;
    }

    public void setMinLogP(Double minLogP) {
        this.minLogP = minLogP;
    }

    public Double getMaxLogP() {
        return maxLogP;
    }

    public void setMaxLogP(Double maxLogP) {
        this.maxLogP = maxLogP;
    }

    public Instant getCreatedAfter() {
        return createdAfter;
    }

    public void setCreatedAfter(Instant createdAfter) {
        this.createdAfter = createdAfter;
    }

    public Instant getCreatedBefore() {
        return createdBefore;
    }

    public void setCreatedBefore(Instant createdBefore) {
        this.createdBefore = createdBefore;
    }
}
