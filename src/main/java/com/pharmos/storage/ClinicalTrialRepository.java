package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.ClinicalTrial;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Repository
public class ClinicalTrialRepository extends InMemoryRepository<ClinicalTrial> {

    public ClinicalTrialRepository(ObjectMapper objectMapper) {
        super(objectMapper, ClinicalTrial.class, "trial");
    }

    /**
     * @return the trial registered under this external id, or null
     */
    public ClinicalTrial findByTrialId(String trialId) {
        List<ClinicalTrial> matches = findAll(trial -> trialId.equals(trial.getTrialId()));
        return matches.isEmpty() ? null : matches.get(0);
    }

    @Override
    protected Collection<String> parentIds(ClinicalTrial trial, Relation relation) {
        switch (relation) {
            case PROJECT:
                return trial.getProjectId() != null
                    ? Collections.singletonList(trial.getProjectId())
                    : Collections.emptyList();
            case MOLECULE:
                return trial.getMoleculeIds();
            default:
                throw unsupported(relation);
        }
    }
}
