package com.pharmos.graphql;

import com.pharmos.domain.BaseEntity;
import com.pharmos.storage.ClinicalTrialRepository;
import com.pharmos.storage.EntityRepository;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import com.pharmos.storage.Relation;
import com.pharmos.storage.ResearchInsightRepository;
import com.pharmos.storage.ResearchPaperRepository;
import com.pharmos.storage.SafetyEventRepository;
import com.pharmos.storage.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.execution.BatchLoaderRegistry;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Configuration for GraphQL DataLoaders.
 *
 * DataLoaders batch and cache data fetching operations to solve the N+1 query problem.
 * When multiple GraphQL fields request related data, DataLoader collects all the keys
 * and makes a single batch request instead of multiple individual requests.
 *
 * The {@link BatchLoaderRegistry} creates a fresh DataLoader for every request, so
 * the per-key cache lives exactly as long as one GraphQL operation. Within that
 * operation all resolvers share it: a key requested from several places in the
 * query tree is fetched once.
 *
 * All loaders are mapped loaders. Results are re-keyed by id, so alignment with
 * the requested keys never depends on the repository's ordering.
 *
 * Example scenario:
 * Without DataLoader:
 *   - Query 3 molecules of a project
 *   - Each molecule resolves its predictions
 *   - Total repository calls: 1 (molecules) + 3 (predictions) = 4
 *
 * With DataLoader:
 *   - Query 3 molecules of a project
 *   - Batch fetch predictions for all 3 molecule ids in 1 call
 *   - Total repository calls: 1 (molecules) + 1 (predictions) = 2
 */
@Configuration
public class DataLoaderConfig {
    private static final Logger logger = LoggerFactory.getLogger(DataLoaderConfig.class);

    private final DataLoaderMetrics metrics;

    public DataLoaderConfig(
            BatchLoaderRegistry registry,
            UserRepository userRepository,
            MoleculeRepository moleculeRepository,
            ProjectRepository projectRepository,
            ClinicalTrialRepository clinicalTrialRepository,
            ResearchPaperRepository researchPaperRepository,
            SafetyEventRepository safetyEventRepository,
            MLPredictionRepository mlPredictionRepository,
            ResearchInsightRepository researchInsightRepository,
            DataLoaderMetrics metrics) {
        this.metrics = metrics;

        registerById(registry, Loaders.USER_BY_ID, userRepository);
        registerById(registry, Loaders.MOLECULE_BY_ID, moleculeRepository);
        registerById(registry, Loaders.PROJECT_BY_ID, projectRepository);
        registerById(registry, Loaders.CLINICAL_TRIAL_BY_ID, clinicalTrialRepository);
        registerById(registry, Loaders.RESEARCH_PAPER_BY_ID, researchPaperRepository);
        registerById(registry, Loaders.SAFETY_EVENT_BY_ID, safetyEventRepository);
        registerById(registry, Loaders.ML_PREDICTION_BY_ID, mlPredictionRepository);
        registerById(registry, Loaders.RESEARCH_INSIGHT_BY_ID, researchInsightRepository);

        registerByParent(registry, Loaders.MOLECULES_BY_PROJECT_ID, moleculeRepository, Relation.PROJECT);
        registerByParent(registry, Loaders.CLINICAL_TRIALS_BY_PROJECT_ID, clinicalTrialRepository, Relation.PROJECT);
        registerByParent(registry, Loaders.RESEARCH_PAPERS_BY_PROJECT_ID, researchPaperRepository, Relation.PROJECT);
        registerByParent(registry, Loaders.PROJECTS_BY_USER_ID, projectRepository, Relation.USER);
        registerByParent(registry, Loaders.PREDICTIONS_BY_MOLECULE_ID, mlPredictionRepository, Relation.MOLECULE);
        registerByParent(registry, Loaders.SAFETY_EVENTS_BY_MOLECULE_ID, safetyEventRepository, Relation.MOLECULE);
        registerByParent(registry, Loaders.CLINICAL_TRIALS_BY_MOLECULE_ID, clinicalTrialRepository, Relation.MOLECULE);
        registerByParent(registry, Loaders.RESEARCH_PAPERS_BY_MOLECULE_ID, researchPaperRepository, Relation.MOLECULE);
        registerByParent(registry, Loaders.SAFETY_EVENTS_BY_CLINICAL_TRIAL_ID, safetyEventRepository, Relation.CLINICAL_TRIAL);
        registerByParent(registry, Loaders.RESEARCH_PAPERS_BY_CLINICAL_TRIAL_ID, researchPaperRepository, Relation.CLINICAL_TRIAL);
        registerByParent(registry, Loaders.RESEARCH_INSIGHTS_BY_PAPER_ID, researchInsightRepository, Relation.RESEARCH_PAPER);

        logger.info("Registered GraphQL data loaders");
    }

    /**
     * Singular loader: unknown ids are left out of the map and resolve to null.
     */
    private <T extends BaseEntity> void registerById(
            BatchLoaderRegistry registry, String name, EntityRepository<T> repository) {

        registry.<String, T>forName(name).registerMappedBatchLoader((ids, environment) -> {
            List<String> keys = new ArrayList<>(ids);
            return fetch(name, keys.size(), () -> {
                List<T> found = repository.findByIds(keys);
                Map<String, T> byId = new HashMap<>();
                for (int i = 0; i < keys.size(); i++) {
                    if (found.get(i) != null) {
                        byId.put(keys.get(i), found.get(i));
                    }
                }
                logger.debug("DataLoader {} fetched {} of {} keys", name, byId.size(), keys.size());
                return byId;
            });
        });
    }

    /**
     * One-to-many loader: every key maps to a list, empty when nothing references it.
     */
    private <T extends BaseEntity> void registerByParent(
            BatchLoaderRegistry registry, String name, EntityRepository<T> repository, Relation relation) {

        registry.<String, List<T>>forName(name).registerMappedBatchLoader((parentIds, environment) ->
            fetch(name, parentIds.size(), () -> {
                Map<String, List<T>> byParent = new HashMap<>(repository.findAllByParentIds(relation, parentIds));
                for (String parentId : parentIds) {
                    byParent.putIfAbsent(parentId, new ArrayList<>());
                }
                logger.debug("DataLoader {} fetched children for {} parents", name, parentIds.size());
                return byParent;
            }));
    }

    /**
     * Run one batch. A failure fails every key of this batch with
     * {@link BatchFetchException} and nothing else.
     */
    private <V> Mono<Map<String, V>> fetch(String name, int keyCount, Callable<Map<String, V>> batch) {
        metrics.recordBatch(name, keyCount);
        return Mono.fromCallable(batch)
            .onErrorMap(e -> {
                logger.error("DataLoader {} batch of {} keys failed: {}", name, keyCount, e.getMessage());
                metrics.recordFailure(name);
                return new BatchFetchException(name, keyCount, e);
            });
    }
}
