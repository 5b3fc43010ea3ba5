package com.pharmos.graphql;

import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.ModelType;
import com.pharmos.domain.Molecule;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.prediction.Prediction;
import com.pharmos.prediction.PredictionProvider;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;

/**
 * GraphQL controller for model predictions.
 *
 * Predictions are computed synchronously by the {@link PredictionProvider} and
 * stored before {@code ML_PREDICTION_COMPLETED} is published.
 */
@Controller
public class MLPredictionController {
    private static final Logger logger = LoggerFactory.getLogger(MLPredictionController.class);

    private final MLPredictionRepository predictionRepository;
    private final MoleculeRepository moleculeRepository;
    private final PredictionProvider predictionProvider;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public MLPredictionController(
            MLPredictionRepository predictionRepository,
            MoleculeRepository moleculeRepository,
            PredictionProvider predictionProvider,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.predictionRepository = predictionRepository;
        this.moleculeRepository = moleculeRepository;
        this.predictionProvider = predictionProvider;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<MLPrediction> mlPrediction(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.ML_PREDICTION_BY_ID, id);
    }

    @QueryMapping
    public Paginated<MLPrediction> mlPredictions(
            @Argument String moleculeId,
            @Argument ModelType modelType,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(
            predictionRepository.findAll(prediction ->
                Predicates.equalsIfSet(moleculeId, prediction.getMoleculeId())
                    && Predicates.equalsIfSet(modelType, prediction.getModelType())),
            pagination,
            SortKeys.ML_PREDICTION);
    }

    /**
     * Score a stored molecule with the given model and keep the result.
     *
     * @throws GraphQLException INVALID_INPUT if the molecule does not exist
     */
    @MutationMapping
    public MLPrediction requestPrediction(
            @Argument String moleculeId,
            @Argument ModelType modelType,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(modelType, "modelType");
        Molecule molecule = moleculeRepository.findById(Inputs.requireText(moleculeId, "moleculeId"));
        if (molecule == null) {
            throw GraphQLException.invalidInput("Unknown molecule: " + moleculeId);
        }

        Prediction result = predictionProvider.predict(molecule.getSmiles(), modelType);

        MLPrediction prediction = new MLPrediction();
        prediction.setMoleculeId(molecule.getId());
        prediction.setModelType(modelType);
        prediction.setModelVersion(result.getModelVersion());
        prediction.setPredictions(new LinkedHashMap<>(result.getValues()));
        prediction.setConfidence(result.getConfidence());
        prediction.setTimestamp(Instant.now());

        MLPrediction created = predictionRepository.create(prediction);
        logger.info("{} prediction {} for molecule {} requested by {}",
            modelType, created.getId(), molecule.getId(), identity.getId());

        String projectId = molecule.getProjectIds().isEmpty() ? null : molecule.getProjectIds().get(0);
        activityFeed.publish(Topic.ML_PREDICTION_COMPLETED, created, created.getId(), projectId, identity,
            modelType + " prediction completed for " + molecule.getName());
        return created;
    }

    @SchemaMapping(typeName = "MLPrediction", field = "molecule")
    public CompletableFuture<Molecule> molecule(MLPrediction prediction, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.MOLECULE_BY_ID, prediction.getMoleculeId());
    }
}
