package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.Role;
import com.pharmos.domain.User;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.graphql.input.ProjectInput;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.ProjectFilter;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.ProjectRepository;
import com.pharmos.storage.UserRepository;
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
 * GraphQL controller for projects and their membership.
 *
 * Modifying a project requires being its lead or holding a managing role.
 */
@Controller
public class ProjectController {
    private static final Logger logger = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public ProjectController(
            ProjectRepository projectRepository,
            UserRepository userRepository,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.projectRepository = projectRepository;
        this.userRepository = userRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<Project> project(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.PROJECT_BY_ID, id);
    }

    @QueryMapping
    public Paginated<Project> projects(
            @Argument ProjectFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(projectRepository.findAll(filter), pagination, SortKeys.PROJECT);
    }

    /**
     * Case-insensitive search over name and description.
     */
    @QueryMapping
    public Paginated<Project> searchProjects(
            @Argument String query,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<Project> matches = projectRepository.findAll(
            project -> Predicates.matchesText(query, project.getName(), project.getDescription()));
        return paginator.paginate(matches, pagination, SortKeys.PROJECT);
    }

    /**
     * Projects the caller leads or is a team member of.
     */
    @QueryMapping
    public Paginated<Project> myProjects(
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<Project> mine = projectRepository.findAll(project -> project.hasMember(identity.getId()));
        return paginator.paginate(mine, pagination, SortKeys.PROJECT);
    }

    /**
     * Create a project. The caller becomes lead unless the input names one.
     */
    @MutationMapping
    public Project createProject(
            @Argument ProjectInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.LEAD_SCIENTIST, Role.PROJECT_MANAGER);
        Inputs.requirePresent(input, "input").validateForCreate();
        requireUsers(input.getLeadId(), input.getTeamIds());

        Project created = projectRepository.create(input.toEntity(identity.getId()));
        logger.info("Project {} ({}) created by {}", created.getId(), created.getName(), identity.getId());

        activityFeed.publish(Topic.PROJECT_CREATED, created, created.getId(), created.getId(),
            identity, "Project " + created.getName() + " created");
        return created;
    }

    @MutationMapping
    public Project updateProject(
            @Argument String id,
            @Argument ProjectInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForUpdate();

        Project existing = projectRepository.findById(id);
        if (existing == null) {
            return null;
        }
        requireManager(identity, existing);
        requireUsers(input.getLeadId(), input.getTeamIds());

        Project updated = projectRepository.update(id, input::applyTo);
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "Project " + updated.getName() + " updated");
        return updated;
    }

    /**
     * Delete a project. Molecules, trials and papers keep their project reference,
     * which then resolves to null.
     */
    @MutationMapping
    public boolean deleteProject(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Project existing = projectRepository.findById(id);
        if (existing == null) {
            return false;
        }
        accessGuard.requireOwnerOrRole(identity, identity.getId().equals(existing.getLeadId()));

        boolean deleted = projectRepository.delete(id);
        if (deleted) {
            logger.info("Project {} deleted by {}", id, identity.getId());
            activityFeed.publish(Topic.PROJECT_DELETED, id, id, id, identity,
                "Project " + existing.getName() + " deleted");
        }
        return deleted;
    }

    @MutationMapping
    public Project addUserToProject(
            @Argument String projectId,
            @Argument String userId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Project existing = projectRepository.findById(projectId);
        if (existing == null) {
            return null;
        }
        requireManager(identity, existing);
        String memberId = Inputs.requireText(userId, "userId");
        requireUsers(memberId, null);

        Project updated = projectRepository.update(projectId, project -> {
            if (!project.getTeamIds().contains(memberId)) {
                project.getTeamIds().add(memberId);
            }
        });
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "User " + memberId + " added to project " + updated.getName());
        return updated;
    }

    @MutationMapping
    public Project removeUserFromProject(
            @Argument String projectId,
            @Argument String userId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Project existing = projectRepository.findById(projectId);
        if (existing == null) {
            return null;
        }
        requireManager(identity, existing);
        String memberId = Inputs.requireText(userId, "userId");

        Project updated = projectRepository.update(projectId, project -> project.getTeamIds().remove(memberId));
        if (updated == null) {
            return null;
        }
        publishUpdated(updated, identity, "User " + memberId + " removed from project " + updated.getName());
        return updated;
    }

    @SchemaMapping(typeName = "Project", field = "lead")
    public CompletableFuture<User> lead(Project project, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.USER_BY_ID, project.getLeadId());
    }

    @SchemaMapping(typeName = "Project", field = "team")
    public CompletableFuture<List<User>> team(Project project, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.USER_BY_ID, project.getTeamIds());
    }

    @SchemaMapping(typeName = "Project", field = "molecules")
    public CompletableFuture<List<Molecule>> molecules(Project project, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.MOLECULES_BY_PROJECT_ID, project.getId());
    }

    @SchemaMapping(typeName = "Project", field = "clinicalTrials")
    public CompletableFuture<List<ClinicalTrial>> clinicalTrials(Project project, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.CLINICAL_TRIALS_BY_PROJECT_ID, project.getId());
    }

    @SchemaMapping(typeName = "Project", field = "researchPapers")
    public CompletableFuture<List<ResearchPaper>> researchPapers(Project project, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.RESEARCH_PAPERS_BY_PROJECT_ID, project.getId());
    }

    private void requireManager(Identity identity, Project project) {
        accessGuard.requireOwnerOrRole(identity, identity.getId().equals(project.getLeadId()), Role.PROJECT_MANAGER);
    }

    private void requireUsers(String leadId, List<String> teamIds) {
        if (leadId != null && userRepository.findById(leadId) == null) {
            throw GraphQLException.invalidInput("Unknown user: " + leadId);
        }
        if (teamIds != null) {
            for (String teamId : teamIds) {
                if (userRepository.findById(teamId) == null) {
                    throw GraphQLException.invalidInput("Unknown user: " + teamId);
                }
            }
        }
    }

    private void publishUpdated(Project project, Identity identity, String description) {
        activityFeed.publish(Topic.PROJECT_UPDATED, project, project.getId(), project.getId(), identity, description);
    }
}
