package com.pharmos.graphql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.ModelType;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Outcome;
import com.pharmos.domain.Role;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.Severity;
import com.pharmos.graphql.analytics.CountByKey;
import com.pharmos.graphql.analytics.MoleculeAnalytics;
import com.pharmos.graphql.analytics.SafetyAnalytics;
import com.pharmos.query.MoleculeFilter;
import com.pharmos.query.SafetyEventFilter;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.storage.ClinicalTrialRepository;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import com.pharmos.storage.SafetyEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Aggregations over seeded in-memory data.
 */
class AnalyticsControllerTest {

    private MoleculeRepository moleculeRepository;
    private SafetyEventRepository safetyEventRepository;
    private MLPredictionRepository predictionRepository;
    private AnalyticsController controller;
    private Identity researcher;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        moleculeRepository = new MoleculeRepository(mapper);
        safetyEventRepository = new SafetyEventRepository(mapper);
        predictionRepository = new MLPredictionRepository(mapper);
        controller = new AnalyticsController(moleculeRepository, new ProjectRepository(mapper),
            new ClinicalTrialRepository(mapper), safetyEventRepository, predictionRepository, new AccessGuard());
        researcher = new Identity("user_researcher", "researcher@pharmos.com", Role.RESEARCHER, Collections.emptyList());

        moleculeRepository.create(molecule("Aspirin", 180.16, 1.2, "proj_1"));
        moleculeRepository.create(molecule("Ibuprofen", 206.28, null, "proj_1"));
        moleculeRepository.create(molecule("Caffeine", 194.19, -0.1, "proj_2"));

        predictionRepository.create(prediction("mol_1"));
        predictionRepository.create(prediction("mol_1"));
        predictionRepository.create(prediction("mol_3"));

        safetyEventRepository.create(event("mol_1", Severity.MILD, Outcome.RECOVERED, 34, "F"));
        safetyEventRepository.create(event("mol_1", Severity.SEVERE, Outcome.RECOVERING, 67, "M"));
        safetyEventRepository.create(event("mol_2", Severity.MILD, Outcome.RECOVERED, 61, null));
    }

    @Test
    void testMoleculeAnalytics_Unfiltered() {
        MoleculeAnalytics analytics = controller.moleculeAnalytics(null, researcher);

        assertThat(analytics.getTotalCount()).isEqualTo(3);
        assertThat(analytics.getAverageMolecularWeight()).isCloseTo((180.16 + 206.28 + 194.19) / 3, within(1e-9));
        assertThat(analytics.getAverageLogP()).isCloseTo(0.55, within(1e-9));
        assertThat(analytics.getPredictionsCount()).isEqualTo(3);
        assertThat(analytics.getSafetyEventsCount()).isEqualTo(3);
        assertThat(analytics.getByProject()).containsExactly(
            new CountByKey("proj_1", 2), new CountByKey("proj_2", 1));
    }

    @Test
    void testMoleculeAnalytics_UsesListFilter() {
        MoleculeFilter filter = new MoleculeFilter();
        filter.setMaxMolecularWeight(200.0);

        MoleculeAnalytics analytics = controller.moleculeAnalytics(filter, researcher);

        assertThat(analytics.getTotalCount()).isEqualTo(2);
        assertThat(analytics.getPredictionsCount()).isEqualTo(3);
        assertThat(analytics.getSafetyEventsCount()).isEqualTo(2);
    }

    @Test
    void testMoleculeAnalytics_EmptySet() {
        MoleculeFilter filter = new MoleculeFilter();
        filter.setName("no such molecule");

        MoleculeAnalytics analytics = controller.moleculeAnalytics(filter, researcher);

        assertThat(analytics.getTotalCount()).isZero();
        assertThat(analytics.getAverageMolecularWeight()).isNull();
        assertThat(analytics.getByProject()).isEmpty();
    }

    @Test
    void testSafetyAnalytics() {
        SafetyAnalytics analytics = controller.safetyAnalytics(null, researcher);

        assertThat(analytics.getTotalEvents()).isEqualTo(3);
        assertThat(analytics.getBySeverity()).containsExactly(
            new CountByKey("MILD", 2), new CountByKey("SEVERE", 1));
        assertThat(analytics.getByAgeGroup()).containsExactly(
            new CountByKey("60-69", 2), new CountByKey("30-39", 1));
        assertThat(analytics.getByGender()).containsExactly(
            new CountByKey("F", 1), new CountByKey("M", 1));
    }

    @Test
    void testSafetyAnalytics_Filtered() {
        SafetyEventFilter filter = new SafetyEventFilter();
        filter.setSeverity(Severity.MILD);

        SafetyAnalytics analytics = controller.safetyAnalytics(filter, researcher);

        assertThat(analytics.getTotalEvents()).isEqualTo(2);
        assertThat(analytics.getByOutcome()).containsExactly(new CountByKey("RECOVERED", 2));
    }

    @Test
    void testAnalytics_RequireIdentity() {
        assertThatThrownBy(() -> controller.safetyAnalytics(null, null))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.UNAUTHENTICATED);
    }

    private static Molecule molecule(String name, double weight, Double logP, String projectId) {
        Molecule molecule = new Molecule();
        molecule.setName(name);
        molecule.setSmiles("C");
        molecule.setMolecularWeight(weight);
        molecule.setLogP(logP);
        molecule.setProjectIds(Arrays.asList(projectId));
        return molecule;
    }

    private static MLPrediction prediction(String moleculeId) {
        MLPrediction prediction = new MLPrediction();
        prediction.setMoleculeId(moleculeId);
        prediction.setModelType(ModelType.TOXICITY);
        return prediction;
    }

    private static SafetyEvent event(String moleculeId, Severity severity, Outcome outcome, int age, String gender) {
        SafetyEvent event = new SafetyEvent();
        event.setMoleculeId(moleculeId);
        event.setSeverity(severity);
        event.setOutcome(outcome);
        event.setPatientAge(age);
        event.setGender(gender);
        event.setEventType("Headache");
        return event;
    }
}
