package com.pharmos.graphql;

import graphql.schema.DataFetchingEnvironment;
import org.dataloader.DataLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Names of the data loaders registered by {@link DataLoaderConfig}.
 *
 * {@code *ById} loaders resolve a missing key to null; the one-to-many loaders
 * resolve it to an empty list.
 */
public final class Loaders {

    public static final String USER_BY_ID = "userById";
    public static final String MOLECULE_BY_ID = "moleculeById";
    public static final String PROJECT_BY_ID = "projectById";
    public static final String CLINICAL_TRIAL_BY_ID = "clinicalTrialById";
    public static final String RESEARCH_PAPER_BY_ID = "researchPaperById";
    public static final String SAFETY_EVENT_BY_ID = "safetyEventById";
    public static final String ML_PREDICTION_BY_ID = "mlPredictionById";
    public static final String RESEARCH_INSIGHT_BY_ID = "researchInsightById";

    public static final String MOLECULES_BY_PROJECT_ID = "moleculesByProjectId";
    public static final String CLINICAL_TRIALS_BY_PROJECT_ID = "clinicalTrialsByProjectId";
    public static final String RESEARCH_PAPERS_BY_PROJECT_ID = "researchPapersByProjectId";
    public static final String PROJECTS_BY_USER_ID = "projectsByUserId";
    public static final String PREDICTIONS_BY_MOLECULE_ID = "predictionsByMoleculeId";
    public static final String SAFETY_EVENTS_BY_MOLECULE_ID = "safetyEventsByMoleculeId";
    public static final String CLINICAL_TRIALS_BY_MOLECULE_ID = "clinicalTrialsByMoleculeId";
    public static final String RESEARCH_PAPERS_BY_MOLECULE_ID = "researchPapersByMoleculeId";
    public static final String SAFETY_EVENTS_BY_CLINICAL_TRIAL_ID = "safetyEventsByClinicalTrialId";
    public static final String RESEARCH_PAPERS_BY_CLINICAL_TRIAL_ID = "researchPapersByClinicalTrialId";
    public static final String RESEARCH_INSIGHTS_BY_PAPER_ID = "researchInsightsByPaperId";

    private Loaders() {
    }

    /**
     * Load one entity by id through the request's loader.
     *
     * @return a future of the entity, or of null when {@code id} is null or unknown
     */
    public static <V> CompletableFuture<V> loadOne(DataFetchingEnvironment env, String loaderName, String id) {
        if (id == null) {
            return CompletableFuture.completedFuture(null);
        }
        DataLoader<String, V> loader = env.getDataLoader(loaderName);
        return loader.load(id);
    }

    /**
     * Load several entities by id. Unknown ids are left out of the result, so a
     * reference to a deleted entity simply disappears from the list.
     */
    public static <V> CompletableFuture<List<V>> loadMany(DataFetchingEnvironment env, String loaderName, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        DataLoader<String, V> loader = env.getDataLoader(loaderName);
        return loader.loadMany(ids).thenApply(values -> values.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList()));
    }

    /**
     * Load the children referencing {@code parentId} through a one-to-many loader.
     */
    public static <V> CompletableFuture<List<V>> loadChildren(DataFetchingEnvironment env, String loaderName, String parentId) {
        DataLoader<String, List<V>> loader = env.getDataLoader(loaderName);
        return loader.load(parentId);
    }
}
