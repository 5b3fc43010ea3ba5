package com.pharmos.graphql;

import com.pharmos.domain.Activity;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Role;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.Severity;
import com.pharmos.events.EventBus;
import com.pharmos.events.EventMetrics;
import com.pharmos.events.OverflowPolicy;
import com.pharmos.events.Topic;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionControllerTest {

    private EventBus eventBus;
    private SubscriptionController controller;
    private Identity researcher;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(16, OverflowPolicy.DROP_OLDEST, new EventMetrics(new SimpleMeterRegistry()));
        controller = new SubscriptionController(eventBus, new AccessGuard());
        researcher = new Identity("user_researcher", "researcher@pharmos.com", Role.RESEARCHER, Collections.emptyList());
    }

    @Test
    void testSubscribe_Unauthenticated() {
        assertThatThrownBy(() -> controller.moleculeCreated(null))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.UNAUTHENTICATED);

        assertThat(eventBus.subscriberCount(Topic.MOLECULE_CREATED)).isZero();
    }

    @Test
    void testSafetyEventCreated_FiltersByMoleculeAndSeverity() {
        StepVerifier.create(controller.safetyEventCreated("mol_1", Severity.SEVERE, researcher))
            .then(() -> {
                eventBus.publish(Topic.SAFETY_EVENT_CREATED, safetyEvent("se_1", "mol_1", Severity.MILD));
                eventBus.publish(Topic.SAFETY_EVENT_CREATED, safetyEvent("se_2", "mol_2", Severity.SEVERE));
                eventBus.publish(Topic.SAFETY_EVENT_CREATED, safetyEvent("se_3", "mol_1", Severity.SEVERE));
            })
            .assertNext(event -> assertThat(event.getId()).isEqualTo("se_3"))
            .thenCancel()
            .verify();

        assertThat(eventBus.subscriberCount(Topic.SAFETY_EVENT_CREATED)).isZero();
    }

    @Test
    void testSafetyEventCreated_NoArgumentsReceivesEverything() {
        StepVerifier.create(controller.safetyEventCreated(null, null, researcher))
            .then(() -> {
                eventBus.publish(Topic.SAFETY_EVENT_CREATED, safetyEvent("se_1", "mol_1", Severity.MILD));
                eventBus.publish(Topic.SAFETY_EVENT_CREATED, safetyEvent("se_2", null, null));
            })
            .expectNextCount(2)
            .thenCancel()
            .verify();
    }

    @Test
    void testMoleculeUpdated_FiltersById() {
        StepVerifier.create(controller.moleculeUpdated("mol_1", researcher))
            .then(() -> eventBus.publish(Topic.MOLECULE_UPDATED, molecule("mol_2")))
            .expectNoEvent(Duration.ofMillis(50))
            .then(() -> eventBus.publish(Topic.MOLECULE_UPDATED, molecule("mol_1")))
            .assertNext(molecule -> assertThat(molecule.getId()).isEqualTo("mol_1"))
            .then(() -> eventBus.publish(Topic.MOLECULE_UPDATED, molecule("mol_3")))
            .expectNoEvent(Duration.ofMillis(50))
            .thenCancel()
            .verify();

        assertThat(eventBus.subscriberCount(Topic.MOLECULE_UPDATED)).isZero();
    }

    @Test
    void testMoleculeUpdated_NoIdReceivesEveryUpdate() {
        StepVerifier.create(controller.moleculeUpdated(null, researcher))
            .then(() -> {
                eventBus.publish(Topic.MOLECULE_UPDATED, molecule("mol_1"));
                eventBus.publish(Topic.MOLECULE_UPDATED, molecule("mol_2"));
            })
            .assertNext(molecule -> assertThat(molecule.getId()).isEqualTo("mol_1"))
            .assertNext(molecule -> assertThat(molecule.getId()).isEqualTo("mol_2"))
            .expectNoEvent(Duration.ofMillis(50))
            .thenCancel()
            .verify();
    }

    @Test
    void testMoleculeDeleted_DeliversIds() {
        StepVerifier.create(controller.moleculeDeleted(researcher))
            .then(() -> eventBus.publish(Topic.MOLECULE_DELETED, "mol_7"))
            .expectNext("mol_7")
            .thenCancel()
            .verify();
    }

    @Test
    void testProjectActivity_RequiresProjectId() {
        assertThatThrownBy(() -> controller.projectActivity(" ", researcher))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.INVALID_INPUT);
    }

    @Test
    void testUserActivity_OnlyThatUser() {
        StepVerifier.create(controller.userActivity("user_lead", researcher))
            .then(() -> {
                eventBus.publish(Topic.ACTIVITY_RECORDED, activity("a1", "user_pm"));
                eventBus.publish(Topic.ACTIVITY_RECORDED, activity("a2", "user_lead"));
            })
            .assertNext(activity -> assertThat(activity.getId()).isEqualTo("a2"))
            .thenCancel()
            .verify();
    }

    @Test
    void testMatchesIfSet() {
        assertThat(SubscriptionController.matchesIfSet(null, "anything")).isTrue();
        assertThat(SubscriptionController.matchesIfSet("mol_1", "mol_1")).isTrue();
        assertThat(SubscriptionController.matchesIfSet("mol_1", null)).isFalse();
    }

    private static Molecule molecule(String id) {
        Molecule molecule = new Molecule();
        molecule.setId(id);
        return molecule;
    }

    private static SafetyEvent safetyEvent(String id, String moleculeId, Severity severity) {
        SafetyEvent event = new SafetyEvent();
        event.setId(id);
        event.setMoleculeId(moleculeId);
        event.setSeverity(severity);
        return event;
    }

    private static Activity activity(String id, String userId) {
        return new Activity(id, "MOLECULE_UPDATED", "Molecule", "mol_1", userId, null, "updated", Instant.now());
    }
}
