package com.pharmos.events;

import com.pharmos.domain.Activity;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Role;
import com.pharmos.security.Identity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityFeedTest {

    private EventBus eventBus;
    private ActivityFeed activityFeed;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(16, OverflowPolicy.DROP_OLDEST, new EventMetrics(new SimpleMeterRegistry()));
        activityFeed = new ActivityFeed(eventBus);
    }

    @Test
    void testPublish_EntityEventThenActivity() {
        List<Object> received = new ArrayList<>();
        Disposable entities = eventBus.subscribe(Molecule.class, m -> true, Topic.MOLECULE_CREATED)
            .subscribe(received::add);
        Disposable activities = eventBus.subscribe(Activity.class, a -> true, Topic.ACTIVITY_RECORDED)
            .subscribe(received::add);

        Molecule molecule = new Molecule();
        molecule.setId("mol_1");
        Identity actor = new Identity("user_1", "smith@pharmos.example", Role.RESEARCHER, Collections.emptyList());

        activityFeed.publish(Topic.MOLECULE_CREATED, molecule, "mol_1", "proj_1", actor, "Molecule created");

        assertThat(received).hasSize(2);
        assertThat(received.get(0)).isSameAs(molecule);
        Activity activity = (Activity) received.get(1);
        assertThat(activity.getType()).isEqualTo("MOLECULE_CREATED");
        assertThat(activity.getEntityType()).isEqualTo("Molecule");
        assertThat(activity.getEntityId()).isEqualTo("mol_1");
        assertThat(activity.getUserId()).isEqualTo("user_1");
        assertThat(activity.getProjectId()).isEqualTo("proj_1");
        assertThat(activity.getTimestamp()).isNotNull();

        entities.dispose();
        activities.dispose();
    }

    @Test
    void testPublish_WithoutActor() {
        List<Activity> activities = new ArrayList<>();
        Disposable subscription = eventBus.subscribe(Activity.class, a -> true, Topic.ACTIVITY_RECORDED)
            .subscribe(activities::add);

        activityFeed.publish(Topic.PROJECT_DELETED, "proj_1", "proj_1", "proj_1", null, "Project deleted");
        activityFeed.publish(Topic.PROJECT_DELETED, "proj_2", "proj_2", "proj_2", null, "Project deleted");

        assertThat(activities).hasSize(2);
        assertThat(activities.get(0).getUserId()).isNull();
        assertThat(activities.get(0).getId()).isNotEqualTo(activities.get(1).getId());
        subscription.dispose();
    }
}
