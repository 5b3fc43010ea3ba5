package com.pharmos.domain;

import java.time.Instant;

/**
 * One entry of the live activity feed. Published alongside every entity event
 * and never stored.
 */
public class Activity {

    private String id;
    private String type;
    private String entityType;
    private String entityId;
    private String userId;
    private String projectId;
    private String description;
    private Instant timestamp;

    public Activity() {
    }

    public Activity(String id, String type, String entityType, String entityId,
                    String userId, String projectId, String description, Instant timestamp) {
        this.id = id;
        this.type = type;
        this.entityType = entityType;
        this.entityId = entityId;
        this.userId = userId;
        this.projectId = projectId;
        this.description = description;
        this.timestamp = timestamp;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    /**
     * Topic name the activity was derived from, e.g. MOLECULE_CREATED
     */
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
