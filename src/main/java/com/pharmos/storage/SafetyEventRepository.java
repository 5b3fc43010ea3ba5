package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.SafetyEvent;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;

@Repository
public class SafetyEventRepository extends InMemoryRepository<SafetyEvent> {

    public SafetyEventRepository(ObjectMapper objectMapper) {
        super(objectMapper, SafetyEvent.class, "ae");
    }

    @Override
    protected Collection<String> parentIds(SafetyEvent event, Relation relation) {
        String parentId;
        switch (relation) {
            case MOLECULE:
                parentId = event.getMoleculeId();
                break;
            case CLINICAL_TRIAL:
                parentId = event.getClinicalTrialId();
                break;
            case USER:
                parentId = event.getReportedById();
                break;
            default:
                throw unsupported(relation);
        }
        return parentId != null ? Collections.singletonList(parentId) : Collections.emptyList();
    }
}
