package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchInsight;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.Role;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.graphql.input.ResearchPaperInput;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.ResearchPaperFilter;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ResearchPaperRepository;
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
 * GraphQL controller for research papers and their links to molecules.
 */
@Controller
public class ResearchPaperController {
    private static final Logger logger = LoggerFactory.getLogger(ResearchPaperController.class);

    private final ResearchPaperRepository paperRepository;
    private final MoleculeRepository moleculeRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public ResearchPaperController(
            ResearchPaperRepository paperRepository,
            MoleculeRepository moleculeRepository,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.paperRepository = paperRepository;
        this.moleculeRepository = moleculeRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<ResearchPaper> researchPaper(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.RESEARCH_PAPER_BY_ID, id);
    }

    @QueryMapping
    public ResearchPaper researchPaperByPmid(
            @Argument String pmid,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paperRepository.findByPmid(Inputs.requireText(pmid, "pmid"));
    }

    @QueryMapping
    public Paginated<ResearchPaper> researchPapers(
            @Argument ResearchPaperFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(paperRepository.findAll(filter), pagination, SortKeys.RESEARCH_PAPER);
    }

    /**
     * Case-insensitive search over title and abstract.
     */
    @QueryMapping
    public Paginated<ResearchPaper> searchResearchPapers(
            @Argument String query,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<ResearchPaper> matches = paperRepository.findAll(
            paper -> Predicates.matchesText(query, paper.getTitle(), paper.getAbstract()));
        return paginator.paginate(matches, pagination, SortKeys.RESEARCH_PAPER);
    }

    @MutationMapping
    public ResearchPaper createResearchPaper(
            @Argument ResearchPaperInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForCreate();
        if (input.getPmid() != null && paperRepository.findByPmid(input.getPmid().trim()) != null) {
            throw GraphQLException.invalidInput("Paper with PMID " + input.getPmid() + " already exists");
        }

        ResearchPaper created = paperRepository.create(input.toEntity());
        logger.info("Research paper {} created by {}", created.getId(), identity.getId());

        activityFeed.publish(Topic.RESEARCH_PAPER_CREATED, created, created.getId(), created.getProjectId(),
            identity, "Research paper \"" + created.getTitle() + "\" added");
        return created;
    }

    @MutationMapping
    public ResearchPaper updateResearchPaper(
            @Argument String id,
            @Argument ResearchPaperInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForUpdate();

        ResearchPaper updated = paperRepository.update(id, input::applyTo);
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Research paper \"" + updated.getTitle() + "\" updated");
        return updated;
    }

    @MutationMapping
    public boolean deleteResearchPaper(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.LEAD_SCIENTIST);

        boolean deleted = paperRepository.delete(id);
        if (deleted) {
            logger.info("Research paper {} deleted by {}", id, identity.getId());
            activityFeed.publish(Topic.RESEARCH_PAPER_DELETED, id, id, null, identity,
                "Research paper " + id + " deleted");
        }
        return deleted;
    }

    @MutationMapping
    public ResearchPaper linkPaperToMolecule(
            @Argument String paperId,
            @Argument String moleculeId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        String linkedId = Inputs.requireText(moleculeId, "moleculeId");
        Molecule molecule = moleculeRepository.findById(linkedId);
        if (molecule == null) {
            throw GraphQLException.invalidInput("Unknown molecule: " + moleculeId);
        }

        ResearchPaper updated = paperRepository.update(paperId, paper -> {
            if (!paper.getMoleculeIds().contains(linkedId)) {
                paper.getMoleculeIds().add(linkedId);
            }
        });
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Paper " + updated.getId() + " linked to molecule " + molecule.getName());
        return updated;
    }

    @MutationMapping
    public ResearchPaper unlinkPaperFromMolecule(
            @Argument String paperId,
            @Argument String moleculeId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        String linkedId = Inputs.requireText(moleculeId, "moleculeId");

        ResearchPaper updated = paperRepository.update(paperId, paper -> paper.getMoleculeIds().remove(linkedId));
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Paper " + updated.getId() + " unlinked from molecule " + linkedId);
        return updated;
    }

    @SchemaMapping(typeName = "ResearchPaper", field = "project")
    public CompletableFuture<Project> project(ResearchPaper paper, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.PROJECT_BY_ID, paper.getProjectId());
    }

    @SchemaMapping(typeName = "ResearchPaper", field = "molecules")
    public CompletableFuture<List<Molecule>> molecules(ResearchPaper paper, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.MOLECULE_BY_ID, paper.getMoleculeIds());
    }

    @SchemaMapping(typeName = "ResearchPaper", field = "clinicalTrials")
    public CompletableFuture<List<ClinicalTrial>> clinicalTrials(ResearchPaper paper, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.CLINICAL_TRIAL_BY_ID, paper.getClinicalTrialIds());
    }

    @SchemaMapping(typeName = "ResearchPaper", field = "researchInsights")
    public CompletableFuture<List<ResearchInsight>> researchInsights(ResearchPaper paper, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.RESEARCH_INSIGHTS_BY_PAPER_ID, paper.getId());
    }

    private void publishUpdated(ResearchPaper paper, Identity identity, String description) {
        activityFeed.publish(Topic.RESEARCH_PAPER_UPDATED, paper, paper.getId(), paper.getProjectId(),
            identity, description);
    }
}
