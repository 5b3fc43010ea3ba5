package com.pharmos.graphql;

import com.pharmos.domain.Activity;
import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchInsight;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.Severity;
import com.pharmos.events.EventBus;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.SubscriptionMapping;
import org.springframework.stereotype.Controller;
import reactor.core.publisher.Flux;

import java.util.Objects;

/**
 * GraphQL subscriptions backed by the {@link EventBus}.
 *
 * Optional arguments narrow the stream; an absent argument delivers every event
 * of the topic. The identity check runs when the subscription is opened.
 */
@Controller
public class SubscriptionController {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionController.class);

    private final EventBus eventBus;
    private final AccessGuard accessGuard;

    public SubscriptionController(EventBus eventBus, AccessGuard accessGuard) {
        this.eventBus = eventBus;
        this.accessGuard = accessGuard;
    }

    @SubscriptionMapping
    public Flux<Molecule> moleculeCreated(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.MOLECULE_CREATED);
        return eventBus.subscribe(Molecule.class, molecule -> true, Topic.MOLECULE_CREATED);
    }

    @SubscriptionMapping
    public Flux<Molecule> moleculeUpdated(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.MOLECULE_UPDATED);
        return eventBus.subscribe(Molecule.class, molecule -> matchesIfSet(id, molecule.getId()), Topic.MOLECULE_UPDATED);
    }

    /**
     * Emits the id of each deleted molecule.
     */
    @SubscriptionMapping
    public Flux<String> moleculeDeleted(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.MOLECULE_DELETED);
        return eventBus.subscribe(String.class, id -> true, Topic.MOLECULE_DELETED);
    }

    @SubscriptionMapping
    public Flux<Project> projectCreated(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.PROJECT_CREATED);
        return eventBus.subscribe(Project.class, project -> true, Topic.PROJECT_CREATED);
    }

    @SubscriptionMapping
    public Flux<Project> projectUpdated(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.PROJECT_UPDATED);
        return eventBus.subscribe(Project.class, project -> matchesIfSet(id, project.getId()), Topic.PROJECT_UPDATED);
    }

    @SubscriptionMapping
    public Flux<String> projectDeleted(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.PROJECT_DELETED);
        return eventBus.subscribe(String.class, id -> true, Topic.PROJECT_DELETED);
    }

    @SubscriptionMapping
    public Flux<ClinicalTrial> clinicalTrialCreated(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.CLINICAL_TRIAL_CREATED);
        return eventBus.subscribe(ClinicalTrial.class, trial -> true, Topic.CLINICAL_TRIAL_CREATED);
    }

    @SubscriptionMapping
    public Flux<ClinicalTrial> clinicalTrialUpdated(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.CLINICAL_TRIAL_UPDATED);
        return eventBus.subscribe(ClinicalTrial.class, trial -> matchesIfSet(id, trial.getId()),
            Topic.CLINICAL_TRIAL_UPDATED);
    }

    @SubscriptionMapping
    public Flux<String> clinicalTrialDeleted(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.CLINICAL_TRIAL_DELETED);
        return eventBus.subscribe(String.class, id -> true, Topic.CLINICAL_TRIAL_DELETED);
    }

    @SubscriptionMapping
    public Flux<ResearchPaper> researchPaperCreated(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.RESEARCH_PAPER_CREATED);
        return eventBus.subscribe(ResearchPaper.class, paper -> true, Topic.RESEARCH_PAPER_CREATED);
    }

    /**
     * New adverse event reports, optionally narrowed to one molecule and/or one severity.
     */
    @SubscriptionMapping
    public Flux<SafetyEvent> safetyEventCreated(
            @Argument String moleculeId,
            @Argument Severity severity,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.SAFETY_EVENT_CREATED);
        return eventBus.subscribe(SafetyEvent.class,
            event -> matchesIfSet(moleculeId, event.getMoleculeId())
                && (severity == null || severity == event.getSeverity()),
            Topic.SAFETY_EVENT_CREATED);
    }

    @SubscriptionMapping
    public Flux<SafetyEvent> safetyEventUpdated(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.SAFETY_EVENT_UPDATED);
        return eventBus.subscribe(SafetyEvent.class, event -> matchesIfSet(id, event.getId()),
            Topic.SAFETY_EVENT_UPDATED);
    }

    @SubscriptionMapping
    public Flux<MLPrediction> mlPredictionCompleted(
            @Argument String moleculeId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.ML_PREDICTION_COMPLETED);
        return eventBus.subscribe(MLPrediction.class,
            prediction -> matchesIfSet(moleculeId, prediction.getMoleculeId()),
            Topic.ML_PREDICTION_COMPLETED);
    }

    @SubscriptionMapping
    public Flux<ResearchInsight> researchInsightGenerated(
            @Argument String topic,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.RESEARCH_INSIGHT_GENERATED);
        return eventBus.subscribe(ResearchInsight.class,
            insight -> matchesIfSet(topic, insight.getTopic()),
            Topic.RESEARCH_INSIGHT_GENERATED);
    }

    /**
     * Every activity record, across all users and projects.
     */
    @SubscriptionMapping
    public Flux<Activity> recentActivity(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.ACTIVITY_RECORDED);
        return eventBus.subscribe(Activity.class, activity -> true, Topic.ACTIVITY_RECORDED);
    }

    @SubscriptionMapping
    public Flux<Activity> userActivity(
            @Argument String userId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.ACTIVITY_RECORDED);
        String required = Inputs.requireText(userId, "userId");
        return eventBus.subscribe(Activity.class, activity -> required.equals(activity.getUserId()),
            Topic.ACTIVITY_RECORDED);
    }

    @SubscriptionMapping
    public Flux<Activity> projectActivity(
            @Argument String projectId,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        open(identity, Topic.ACTIVITY_RECORDED);
        String required = Inputs.requireText(projectId, "projectId");
        return eventBus.subscribe(Activity.class, activity -> required.equals(activity.getProjectId()),
            Topic.ACTIVITY_RECORDED);
    }

    private void open(Identity identity, Topic topic) {
        accessGuard.requireIdentity(identity);
        logger.debug("{} subscribing to {}", identity.getId(), topic);
    }

    /**
     * Predicate helper: an absent argument matches everything.
     */
    static boolean matchesIfSet(String expected, String actual) {
        return expected == null || Objects.equals(expected, actual);
    }
}
