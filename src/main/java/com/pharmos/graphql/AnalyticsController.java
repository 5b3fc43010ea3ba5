package com.pharmos.graphql;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.graphql.analytics.ClinicalTrialAnalytics;
import com.pharmos.graphql.analytics.CountByKey;
import com.pharmos.graphql.analytics.MoleculeAnalytics;
import com.pharmos.graphql.analytics.ProjectAnalytics;
import com.pharmos.graphql.analytics.SafetyAnalytics;
import com.pharmos.query.ClinicalTrialFilter;
import com.pharmos.query.MoleculeFilter;
import com.pharmos.query.ProjectFilter;
import com.pharmos.query.SafetyEventFilter;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.ClinicalTrialRepository;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import com.pharmos.storage.Relation;
import com.pharmos.storage.SafetyEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregate queries. Each one applies the same filter as the matching list query
 * and aggregates over the filtered set.
 */
@Controller
public class AnalyticsController {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsController.class);

    private final MoleculeRepository moleculeRepository;
    private final ProjectRepository projectRepository;
    private final ClinicalTrialRepository trialRepository;
    private final SafetyEventRepository safetyEventRepository;
    private final MLPredictionRepository predictionRepository;
    private final AccessGuard accessGuard;

    public AnalyticsController(
            MoleculeRepository moleculeRepository,
            ProjectRepository projectRepository,
            ClinicalTrialRepository trialRepository,
            SafetyEventRepository safetyEventRepository,
            MLPredictionRepository predictionRepository,
            AccessGuard accessGuard) {
        this.moleculeRepository = moleculeRepository;
        this.projectRepository = projectRepository;
        this.trialRepository = trialRepository;
        this.safetyEventRepository = safetyEventRepository;
        this.predictionRepository = predictionRepository;
        this.accessGuard = accessGuard;
    }

    @QueryMapping
    public MoleculeAnalytics moleculeAnalytics(
            @Argument MoleculeFilter filter,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<Molecule> molecules = moleculeRepository.findAll(filter);
        List<String> ids = molecules.stream().map(Molecule::getId).collect(Collectors.toList());

        int predictions = totalChildren(predictionRepository.findAllByParentIds(Relation.MOLECULE, ids));
        int safetyEvents = totalChildren(safetyEventRepository.findAllByParentIds(Relation.MOLECULE, ids));
        List<CountByKey> byProject = CountByKey.count(
            molecules.stream()
                .flatMap(molecule -> molecule.getProjectIds().stream())
                .collect(Collectors.toList()),
            projectId -> projectId);

        logger.debug("moleculeAnalytics over {} molecules", molecules.size());
        return new MoleculeAnalytics(
            molecules.size(),
            average(molecules, Molecule::getMolecularWeight),
            average(molecules, Molecule::getLogP),
            predictions,
            safetyEvents,
            byProject);
    }

    @QueryMapping
    public ProjectAnalytics projectAnalytics(
            @Argument ProjectFilter filter,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<Project> projects = projectRepository.findAll(filter);

        double totalBudget = projects.stream()
            .map(Project::getBudget)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .sum();

        return new ProjectAnalytics(
            projects.size(),
            CountByKey.count(projects, Project::getStatus),
            CountByKey.count(projects, Project::getType),
            totalBudget,
            average(projects, Project::getProgress));
    }

    @QueryMapping
    public ClinicalTrialAnalytics clinicalTrialAnalytics(
            @Argument ClinicalTrialFilter filter,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<ClinicalTrial> trials = trialRepository.findAll(filter);

        long totalEnrollment = trials.stream()
            .map(ClinicalTrial::getEnrollment)
            .filter(Objects::nonNull)
            .mapToLong(Integer::longValue)
            .sum();

        return new ClinicalTrialAnalytics(
            trials.size(),
            CountByKey.count(trials, ClinicalTrial::getPhase),
            CountByKey.count(trials, ClinicalTrial::getStatus),
            CountByKey.count(trials, ClinicalTrial::getCondition),
            totalEnrollment);
    }

    @QueryMapping
    public SafetyAnalytics safetyAnalytics(
            @Argument SafetyEventFilter filter,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        List<SafetyEvent> events = safetyEventRepository.findAll(filter);

        return new SafetyAnalytics(
            events.size(),
            CountByKey.count(events, SafetyEvent::getSeverity),
            CountByKey.count(events, SafetyEvent::getOutcome),
            CountByKey.count(events, SafetyEvent::getEventType),
            CountByKey.count(events, AnalyticsController::ageGroup),
            CountByKey.count(events, SafetyEvent::getGender));
    }

    static String ageGroup(SafetyEvent event) {
        Integer age = event.getPatientAge();
        if (age == null) {
            return null;
        }
        int lower = (age / 10) * 10;
        return lower + "-" + (lower + 9);
    }

    private static <T> Double average(List<T> items, Function<T, Double> value) {
        OptionalDouble avg = items.stream()
            .map(value)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }

    private static int totalChildren(Map<String, ? extends List<?>> byParent) {
        return byParent.values().stream().mapToInt(List::size).sum();
    }
}
