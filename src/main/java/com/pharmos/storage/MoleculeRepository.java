package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.Molecule;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public class MoleculeRepository extends InMemoryRepository<Molecule> {

    public MoleculeRepository(ObjectMapper objectMapper) {
        super(objectMapper, Molecule.class, "mol");
    }

    /**
     * @return the first molecule with exactly this SMILES string, or null
     */
    public Molecule findBySmiles(String smiles) {
        List<Molecule> matches = findAll(molecule -> smiles.equals(molecule.getSmiles()));
        return matches.isEmpty() ? null : matches.get(0);
    }

    @Override
    protected Collection<String> parentIds(Molecule molecule, Relation relation) {
        if (relation == Relation.PROJECT) {
            return molecule.getProjectIds();
        }
        throw unsupported(relation);
    }
}
