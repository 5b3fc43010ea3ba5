package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.ResearchInsight;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public class ResearchInsightRepository extends InMemoryRepository<ResearchInsight> {

    public ResearchInsightRepository(ObjectMapper objectMapper) {
        super(objectMapper, ResearchInsight.class, "insight");
    }

    @Override
    protected Collection<String> parentIds(ResearchInsight insight, Relation relation) {
        if (relation == Relation.RESEARCH_PAPER) {
            return insight.getRelatedPaperIds();
        }
        throw unsupported(relation);
    }
}
