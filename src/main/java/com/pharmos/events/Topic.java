package com.pharmos.events;

/**
 * Closed set of event bus topics, named {@code <ENTITY>_<VERB>}.
 */
public enum Topic {

    MOLECULE_CREATED("Molecule", "created"),
    MOLECULE_UPDATED("Molecule", "updated"),
    MOLECULE_DELETED("Molecule", "deleted"),

    PROJECT_CREATED("Project", "created"),
    PROJECT_UPDATED("Project", "updated"),
    PROJECT_DELETED("Project", "deleted"),

    CLINICAL_TRIAL_CREATED("ClinicalTrial", "created"),
    CLINICAL_TRIAL_UPDATED("ClinicalTrial", "updated"),
    CLINICAL_TRIAL_DELETED("ClinicalTrial", "deleted"),

    RESEARCH_PAPER_CREATED("ResearchPaper", "created"),
    RESEARCH_PAPER_UPDATED("ResearchPaper", "updated"),
    RESEARCH_PAPER_DELETED("ResearchPaper", "deleted"),

    SAFETY_EVENT_CREATED("SafetyEvent", "created"),
    SAFETY_EVENT_UPDATED("SafetyEvent", "updated"),
    SAFETY_EVENT_DELETED("SafetyEvent", "deleted"),

    ML_PREDICTION_COMPLETED("MLPrediction", "completed"),

    RESEARCH_INSIGHT_GENERATED("ResearchInsight", "generated"),

    ACTIVITY_RECORDED("Activity", "recorded");

    private final String entityType;
    private final String verb;

    Topic(String entityType, String verb) {
        this.entityType = entityType;
        this.verb = verb;
    }

    /**
     * GraphQL type name of the entity the topic is about
     */
    public String getEntityType() {
        return entityType;
    }

    public String getVerb() {
        return verb;
    }
}
