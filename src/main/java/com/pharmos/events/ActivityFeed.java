package com.pharmos.events;

import com.pharmos.domain.Activity;
import com.pharmos.security.Identity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes entity events together with their activity feed entry.
 *
 * The entity event goes out first, then an {@link Activity} on
 * {@link Topic#ACTIVITY_RECORDED}. Callers invoke this only after the
 * repository write returned.
 */
@Component
public class ActivityFeed {

    private final EventBus eventBus;
    private final AtomicLong sequence = new AtomicLong();

    public ActivityFeed(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * @param topic entity topic
     * @param payload entity (or id, for deletions) delivered to subscribers of {@code topic}
     * @param entityId id of the affected entity
     * @param projectId project the entity belongs to, may be null
     * @param actor identity that performed the mutation, may be null
     * @param description human-readable summary
     */
    public void publish(Topic topic, Object payload, String entityId, String projectId,
                        Identity actor, String description) {
        eventBus.publish(topic, payload);

        Activity activity = new Activity(
            "activity_" + sequence.incrementAndGet(),
            topic.name(),
            topic.getEntityType(),
            entityId,
            actor != null ? actor.getId() : null,
            projectId,
            description,
            Instant.now());
        eventBus.publish(Topic.ACTIVITY_RECORDED, activity);
    }
}
