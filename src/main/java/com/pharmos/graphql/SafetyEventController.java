package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Role;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.User;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.graphql.input.SafetyEventInput;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.Predicates;
import com.pharmos.query.SafetyEventFilter;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.ClinicalTrialRepository;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.SafetyEventRepository;
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
 * GraphQL controller for adverse event reports.
 *
 * Any authenticated user may file a report; the reporter is always the caller.
 */
@Controller
public class SafetyEventController {
    private static final Logger logger = LoggerFactory.getLogger(SafetyEventController.class);

    private final SafetyEventRepository eventRepository;
    private final MoleculeRepository moleculeRepository;
    private final ClinicalTrialRepository trialRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public SafetyEventController(
            SafetyEventRepository eventRepository,
            MoleculeRepository moleculeRepository,
            ClinicalTrialRepository trialRepository,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.eventRepository = eventRepository;
        this.moleculeRepository = moleculeRepository;
        this.trialRepository = trialRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<SafetyEvent> safetyEvent(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.SAFETY_EVENT_BY_ID, id);
    }

    @QueryMapping
    public Paginated<SafetyEvent> safetyEvents(
            @Argument SafetyEventFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(eventRepository.findAll(filter), pagination, SortKeys.SAFETY_EVENT);
    }

    /**
     * Case-insensitive search over drug name, event type and description.
     */
    @QueryMapping
    public Paginated<SafetyEvent> searchSafetyEvents(
            @Argument String query,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<SafetyEvent> matches = eventRepository.findAll(event ->
            Predicates.matchesText(query, event.getDrugName(), event.getEventType(), event.getDescription()));
        return paginator.paginate(matches, pagination, SortKeys.SAFETY_EVENT);
    }

    @MutationMapping
    public SafetyEvent createSafetyEvent(
            @Argument SafetyEventInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForCreate();
        requireReferences(input);

        SafetyEvent created = eventRepository.create(input.toEntity(identity.getId()));
        logger.info("Safety event {} ({}, {}) reported by {}",
            created.getId(), created.getDrugName(), created.getSeverity(), identity.getId());

        activityFeed.publish(Topic.SAFETY_EVENT_CREATED, created, created.getId(), null, identity,
            created.getSeverity() + " " + created.getEventType() + " reported for " + created.getDrugName());
        return created;
    }

    @MutationMapping
    public SafetyEvent updateSafetyEvent(
            @Argument String id,
            @Argument SafetyEventInput input,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        Inputs.requirePresent(input, "input").validateForUpdate();
        requireReferences(input);

        SafetyEvent updated = eventRepository.update(id, input::applyTo);
        if (updated == null) {
            return null;
        }
        activityFeed.publish(Topic.SAFETY_EVENT_UPDATED, updated, updated.getId(), null, identity,
            "Safety event " + updated.getId() + " updated");
        return updated;
    }

    @MutationMapping
    public boolean deleteSafetyEvent(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.CLINICAL_LEAD);

        boolean deleted = eventRepository.delete(id);
        if (deleted) {
            logger.info("Safety event {} deleted by {}", id, identity.getId());
            activityFeed.publish(Topic.SAFETY_EVENT_DELETED, id, id, null, identity,
                "Safety event " + id + " deleted");
        }
        return deleted;
    }

    @SchemaMapping(typeName = "SafetyEvent", field = "molecule")
    public CompletableFuture<Molecule> molecule(SafetyEvent event, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.MOLECULE_BY_ID, event.getMoleculeId());
    }

    @SchemaMapping(typeName = "SafetyEvent", field = "clinicalTrial")
    public CompletableFuture<ClinicalTrial> clinicalTrial(SafetyEvent event, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.CLINICAL_TRIAL_BY_ID, event.getClinicalTrialId());
    }

    @SchemaMapping(typeName = "SafetyEvent", field = "reportedBy")
    public CompletableFuture<User> reportedBy(SafetyEvent event, DataFetchingEnvironment env) {
        return Loaders.loadOne(env, Loaders.USER_BY_ID, event.getReportedById());
    }

    private void requireReferences(SafetyEventInput input) {
        if (input.getMoleculeId() != null && moleculeRepository.findById(input.getMoleculeId()) == null) {
            throw GraphQLException.invalidInput("Unknown molecule: " + input.getMoleculeId());
        }
        if (input.getClinicalTrialId() != null && trialRepository.findById(input.getClinicalTrialId()) == null) {
            throw GraphQLException.invalidInput("Unknown clinical trial: " + input.getClinicalTrialId());
        }
    }
}
