package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.Role;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.ClinicalTrialInput;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.query.ClinicalTrialFilter;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.ClinicalTrialRepository;
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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * GraphQL controller for clinical trials. Writes are limited to clinical leads.
 */
@Controller
public class ClinicalTrialController {
    private static final Logger logger = LoggerFactory.getLogger(ClinicalTrialController.class);

    private final ClinicalTrialRepository trialRepository;
    private final ProjectRepository projectRepository;
    private final MoleculeRepository moleculeRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public ClinicalTrialController(
            ClinicalTrialRepository trialRepository,
            ProjectRepository projectRepository,
            MoleculeRepository moleculeRepository,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.trialRepository = trialRepository;
        this.projectRepository = projectRepository;
        this.moleculeRepository = moleculeRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<ClinicalTrial> clinicalTrial(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.CLINICAL_TRIAL_BY_ID, id);
    }

    /**
     * Look up a trial by its registry number (NCT...).
     */
    @QueryMapping
    public ClinicalTrial clinicalTrialByTrialId(
            @Argument String trialId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return trialRepository.findByTrialId(Inputs.requireText(trialId, "trialId"));
    }

    @QueryMapping
    public Paginated<ClinicalTrial> clinicalTrials(
            @Argument ClinicalTrialFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(trialRepository.findAll(filter), pagination, SortKeys.CLINICAL_TRIAL);
    }

    /**
     * Case-insensitive search over title, condition and description.
     */
    @QueryMapping
    public Paginated<ClinicalTrial> searchClinicalTrials(
            @Argument String query,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<ClinicalTrial> matches = trialRepository.findAll(trial ->
            Predicates.matchesText(query, trial.getTitle(), trial.getCondition(), trial.getDescription()));
        return paginator.paginate(matches, pagination, SortKeys.CLINICAL_TRIAL);
    }

    @MutationMapping
    public ClinicalTrial createClinicalTrial(
            @Argument ClinicalTrialInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);
        Inputs.requirePresent(input, "input").validateForCreate();
        requireProject(input.getProjectId());
        if (trialRepository.findByTrialId(input.getTrialId().trim()) != null) {
            throw GraphQLException.invalidInput("Trial " + input.getTrialId() + " is already registered");
        }

        ClinicalTrial created = trialRepository.create(input.toEntity());
        logger.info("Clinical trial {} ({}) created by {}", created.getId(), created.getTrialId(), identity.getId());

        activityFeed.publish(Topic.CLINICAL_TRIAL_CREATED, created, created.getId(), created.getProjectId(),
            identity, "Clinical trial " + created.getTrialId() + " created");
        return created;
    }

    @MutationMapping
    public ClinicalTrial updateClinicalTrial(
            @Argument String id,
            @Argument ClinicalTrialInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);
        Inputs.requirePresent(input, "input").validateForUpdate();
        requireProject(input.getProjectId());

        ClinicalTrial updated = trialRepository.update(id, input::applyTo);
        if (updated == null) {
            logger.debug("updateClinicalTrial: {} not found", id);
            return null;
        }
        publishUpdated(updated, identity, "Clinical trial " + updated.getTrialId() + " updated");
        return updated;
    }

    @MutationMapping
    public boolean deleteClinicalTrial(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);

        boolean deleted = trialRepository.delete(id);
        if (deleted) {
            logger.info("Clinical trial {} deleted by {}", id, identity.getId());
            activityFeed.publish(Topic.CLINICAL_TRIAL_DELETED, id, id, null, identity,
                "Clinical trial " + id + " deleted");
        }
        return deleted;
    }

    @MutationMapping
    public ClinicalTrial linkMoleculeToTrial(
            @Argument String trialId,
            @Argument String moleculeId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);
        String linkedId = Inputs.requireText(moleculeId, "moleculeId");
        Molecule molecule = moleculeRepository.findById(linkedId);
        if (molecule == null) {
            throw GraphQLException.invalidInput("Unknown molecule: " + moleculeId);
        }

        ClinicalTrial updated = trialRepository.update(trialId, trial -> {
            if (!trial.getMoleculeIds().contains(linkedId)) {
                trial.getMoleculeIds().add(linkedId);
            }
        });
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Molecule " + molecule.getName() + " linked to trial " + updated.getTrialId());
        return updated;
    }

    @MutationMapping
    public ClinicalTrial unlinkMoleculeFromTrial(
            @Argument String trialId,
            @Argument String moleculeId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);
        String linkedId = Inputs.requireText(moleculeId, "moleculeId");

        ClinicalTrial updated = trialRepository.update(trialId, trial -> trial.getMoleculeIds().remove(linkedId));
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Molecule " + linkedId + " unlinked from trial " + updated.getTrialId());
        return updated;
    }

    @SchemaMapping(typeName = "ClinicalTrial", field = "project")
    public CompletableFuture<Project> project(ClinicalTrial trial, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.PROJECT_BY_ID, trial.getProjectId());
    }

    @SchemaMapping(typeName = "ClinicalTrial", field = "molecules")
    public CompletableFuture<List<Molecule>> molecules(ClinicalTrial trial, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.MOLECULE_BY_ID, trial.getMoleculeIds());
    }

    @SchemaMapping(typeName = "ClinicalTrial", field = "safetyEvents")
    public CompletableFuture<List<SafetyEvent>> safetyEvents(ClinicalTrial trial, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.SAFETY_EVENTS_BY_CLINICAL_TRIAL_ID, trial.getId());
    }

    @SchemaMapping(typeName = "ClinicalTrial", field = "publications")
    public CompletableFuture<List<ResearchPaper>> publications(ClinicalTrial trial, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.RESEARCH_PAPERS_BY_CLINICAL_TRIAL_ID, trial.getId());
    }

    private void requireProject(String projectId) {
        if (projectId != null && projectRepository.findById(projectId) == null) {
            throw GraphQLException.invalidInput("Unknown project: " + projectId);
        }
    }

    private void publishUpdated(ClinicalTrial trial, Identity identity, String description) {
        activityFeed.publish(Topic.CLINICAL_TRIAL_UPDATED, trial, trial.getId(), trial.getProjectId(),
            identity, description);
    }
}
