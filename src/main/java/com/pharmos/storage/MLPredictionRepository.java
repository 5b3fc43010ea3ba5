package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.MLPrediction;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;

@Repository
public class MLPredictionRepository extends InMemoryRepository<MLPrediction> {

    public MLPredictionRepository(ObjectMapper objectMapper) {
        super(objectMapper, MLPrediction.class, "pred");
    }

    @Override
    protected Collection<String> parentIds(MLPrediction prediction, Relation relation) {
        if (relation == Relation.MOLECULE) {
            return prediction.getMoleculeId() != null
                ? Collections.singletonList(prediction.getMoleculeId())
                : Collections.emptyList();
        }
        throw unsupported(relation);
    }
}
