package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.Role;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.graphql.input.MoleculeInput;
import com.pharmos.prediction.PredictionProvider;
import com.pharmos.query.MoleculeFilter;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * GraphQL controller for molecules
 *
 * Root queries and mutations check the caller's identity first. Relations of a
 * molecule are resolved through the request's data loaders only, so resolving
 * {@code predictions} on N molecules costs one repository call.
 *
 * Every successful write publishes its event after the repository returned.
 */
@Controller
public class MoleculeController {
    private static final Logger logger = LoggerFactory.getLogger(MoleculeController.class);

    static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;
    static final int DEFAULT_SIMILARITY_LIMIT = 10;

    private final MoleculeRepository moleculeRepository;
    private final ProjectRepository projectRepository;
    private final PredictionProvider predictionProvider;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public MoleculeController(
            MoleculeRepository moleculeRepository,
            ProjectRepository projectRepository,
            PredictionProvider predictionProvider,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.moleculeRepository = moleculeRepository;
        this.projectRepository = projectRepository;
        this.predictionProvider = predictionProvider;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    /**
     * Fetch one molecule through the {@code moleculeById} loader, so a molecule
     * requested again elsewhere in the same operation is not fetched twice.
     *
     * @return the molecule, or null if the id is unknown
     */
    @QueryMapping
    public CompletableFuture<Molecule> molecule(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.MOLECULE_BY_ID, id);
    }

    @QueryMapping
    public Molecule moleculeBySmiles(
            @Argument String smiles,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return moleculeRepository.findBySmiles(Inputs.requireText(smiles, "smiles"));
    }

    @QueryMapping
    public Paginated<Molecule> molecules(
            @Argument MoleculeFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(moleculeRepository.findAll(filter), pagination, SortKeys.MOLECULE);
    }

    /**
     * Case-insensitive search over name and SMILES.
     */
    @QueryMapping
    public Paginated<Molecule> searchMolecules(
            @Argument String query,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<Molecule> matches = moleculeRepository.findAll(
            molecule -> Predicates.matchesText(query, molecule.getName(), molecule.getSmiles()));
        return paginator.paginate(matches, pagination, SortKeys.MOLECULE);
    }

    /**
     * Molecules whose similarity to {@code smiles} reaches the threshold, most
     * similar first. The query structure itself is excluded.
     */
    @QueryMapping
    public List<Molecule> similarMolecules(
            @Argument String smiles,
            @Argument Double threshold,
            @Argument Integer limit,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        String query = Inputs.requireText(smiles, "smiles");
        Inputs.validateSmiles(query);
        double minSimilarity = threshold != null ? threshold : DEFAULT_SIMILARITY_THRESHOLD;
        Inputs.requireBetween(minSimilarity, 0, 1, "threshold");
        int maxResults = limit != null ? Math.max(1, Math.min(limit, paginator.getMaxLimit())) : DEFAULT_SIMILARITY_LIMIT;

        List<Molecule> candidates = moleculeRepository.findAll(molecule -> !query.equals(molecule.getSmiles()));
        return candidates.stream()
            .map(molecule -> new Scored(molecule, predictionProvider.similarity(query, molecule.getSmiles())))
            .filter(scored -> scored.score >= minSimilarity)
            .sorted(Comparator.comparingDouble((Scored scored) -> scored.score).reversed())
            .limit(maxResults)
            .map(scored -> scored.molecule)
            .collect(Collectors.toList());
    }

    @MutationMapping
    public Molecule createMolecule(
            @Argument MoleculeInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForCreate();

        Molecule created = moleculeRepository.create(input.toEntity());
        logger.info("Molecule {} ({}) created by {}", created.getId(), created.getName(), identity.getId());

        publishCreated(created, identity);
        return created;
    }

    /**
     * Create several molecules. Every input is validated before the first write,
     * so an invalid entry leaves nothing behind.
     */
    @MutationMapping
    public List<Molecule> createMoleculesBatch(
            @Argument List<MoleculeInput> inputs,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        if (inputs == null || inputs.isEmpty()) {
            throw GraphQLException.invalidInput("inputs must contain at least one molecule");
        }
        for (int i = 0; i < inputs.size(); i++) {
            try {
                Inputs.requirePresent(inputs.get(i), "inputs[" + i + "]").validateForCreate();
            } catch (GraphQLException e) {
                throw GraphQLException.invalidInput("inputs[" + i + "]: " + e.getMessage());
            }
        }

        List<Molecule> created = new ArrayList<>(inputs.size());
        for (MoleculeInput input : inputs) {
            Molecule molecule = moleculeRepository.create(input.toEntity());
            publishCreated(molecule, identity);
            created.add(molecule);
        }
        logger.info("Batch of {} molecules created by {}", created.size(), identity.getId());
        return created;
    }

    /**
     * Merge the set input fields into the molecule.
     *
     * @return the updated molecule, or null if the id is unknown
     */
    @MutationMapping
    public Molecule updateMolecule(
            @Argument String id,
            @Argument MoleculeInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForUpdate();

        Molecule updated = moleculeRepository.update(id, input::applyTo);
        if (updated == null) {
            logger.debug("updateMolecule: {} not found", id);
            return null;
        }
        publishUpdated(updated, identity, "Molecule " + updated.getName() + " updated");
        return updated;
    }

    /**
     * Delete a molecule. Entities referencing it keep their reference; it resolves
     * to null or is omitted from lists from now on.
     */
    @MutationMapping
    public boolean deleteMolecule(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.LEAD_SCIENTIST);

        boolean deleted = moleculeRepository.delete(id);
        if (deleted) {
            logger.info("Molecule {} deleted by {}", id, identity.getId());
            activityFeed.publish(Topic.MOLECULE_DELETED, id, id, null, identity, "Molecule " + id + " deleted");
        }
        return deleted;
    }

    @MutationMapping
    public Molecule linkMoleculeToProject(
            @Argument String moleculeId,
            @Argument String projectId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Project project = requireProject(projectId);

        Molecule updated = moleculeRepository.update(moleculeId, molecule -> {
            if (!molecule.getProjectIds().contains(project.getId())) {
                molecule.getProjectIds().add(project.getId());
            }
        });
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Molecule " + updated.getName() + " linked to project " + project.getName());
        return updated;
    }

    @MutationMapping
    public Molecule unlinkMoleculeFromProject(
            @Argument String moleculeId,
            @Argument String projectId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        String linkedId = Inputs.requireText(projectId, "projectId");

        Molecule updated = moleculeRepository.update(moleculeId, molecule -> molecule.getProjectIds().remove(linkedId));
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Molecule " + updated.getName() + " unlinked from project " + linkedId);
        return updated;
    }

    @SchemaMapping(typeName = "Molecule", field = "predictions")
    public CompletableFuture<List<MLPrediction>> predictions(Molecule molecule, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.PREDICTIONS_BY_MOLECULE_ID, molecule.getId());
    }

    @SchemaMapping(typeName = "Molecule", field = "safetyEvents")
    public CompletableFuture<List<SafetyEvent>> safetyEvents(Molecule molecule, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.SAFETY_EVENTS_BY_MOLECULE_ID, molecule.getId());
    }

    @SchemaMapping(typeName = "Molecule", field = "clinicalTrials")
    public CompletableFuture<List<ClinicalTrial>> clinicalTrials(Molecule molecule, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.CLINICAL_TRIALS_BY_MOLECULE_ID, molecule.getId());
    }

    @SchemaMapping(typeName = "Molecule", field = "researchPapers")
    public CompletableFuture<List<ResearchPaper>> researchPapers(Molecule molecule, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.RESEARCH_PAPERS_BY_MOLECULE_ID, molecule.getId());
    }

    @SchemaMapping(typeName = "Molecule", field = "projects")
    public CompletableFuture<List<Project>> projects(Molecule molecule, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.PROJECT_BY_ID, molecule.getProjectIds());
    }

    private Project requireProject(String projectId) {
        Project project = projectRepository.findById(Inputs.requireText(projectId, "projectId"));
        if (project == null) {
            throw GraphQLException.invalidInput("Unknown project: " + projectId);
        }
        return project;
    }

    private void publishCreated(Molecule molecule, Identity identity) {
        activityFeed.publish(Topic.MOLECULE_CREATED, molecule, molecule.getId(), firstProject(molecule),
            identity, "Molecule " + molecule.getName() + " created");
    }

    private void publishUpdated(Molecule molecule, Identity identity, String description) {
        activityFeed.publish(Topic.MOLECULE_UPDATED, molecule, molecule.getId(), firstProject(molecule),
            identity, description);
    }

    private static String firstProject(Molecule molecule) {
        return molecule.getProjectIds().isEmpty() ? null : molecule.getProjectIds().get(0);
    }

    private static final class Scored {
        private final Molecule molecule;
        private final double score;

        Scored(Molecule molecule, double score) {
            this.molecule = molecule;
            this.score = score;
        }
    }
}
