package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.ResearchPaper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Repository
public class ResearchPaperRepository extends InMemoryRepository<ResearchPaper> {

    public ResearchPaperRepository(ObjectMapper objectMapper) {
        super(objectMapper, ResearchPaper.class, "paper");
    }

    /**
     * @return the paper with this PubMed id, or null
     */
    public ResearchPaper findByPmid(String pmid) {
        List<ResearchPaper> matches = findAll(paper -> pmid.equals(paper.getPmid()));
        return matches.isEmpty() ? null : matches.get(0);
    }

    @Override
    protected Collection<String> parentIds(ResearchPaper paper, Relation relation) {
        switch (relation) {
            case PROJECT:
                return paper.getProjectId() != null
                    ? Collections.singletonList(paper.getProjectId())
                    : Collections.emptyList();
            case MOLECULE:
                return paper.getMoleculeIds();
            case CLINICAL_TRIAL:
                return paper.getClinicalTrialIds();
            default:
                throw unsupported(relation);
        }
    }
}
