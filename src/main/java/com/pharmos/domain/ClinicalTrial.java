package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered clinical trial. Belongs to at most one project and studies any
 * number of molecules.
 */
public class ClinicalTrial extends BaseEntity {

    /**
     * External registry identifier, e.g. NCT05123456
     */
    @JsonProperty("trial_id")
    private String trialId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("phase")
    private TrialPhase phase;

    @JsonProperty("status")
    private TrialStatus status;

    @JsonProperty("condition")
    private String condition;

    @JsonProperty("intervention")
    private String intervention;

    @JsonProperty("sponsor")
    private String sponsor;

    @JsonProperty("enrollment")
    private Integer enrollment;

    @JsonProperty("start_date")
    private Instant startDate;

    @JsonProperty("completion_date")
    private Instant completionDate;

    @JsonProperty("description")
    private String description;

    @JsonProperty("primary_endpoint")
    private String primaryEndpoint;

    @JsonProperty("secondary_endpoints")
    private List<String> secondaryEndpoints;

    @JsonProperty("eligibility_criteria")
    private String eligibilityCriteria;

    @JsonProperty("locations")
    private List<String> locations;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("molecule_ids")
    private List<String> moleculeIds;

    public ClinicalTrial() {
        this.secondaryEndpoints = new ArrayList<>();
        this.locations = new ArrayList<>();
        this.moleculeIds = new ArrayList<>();
    }

    public String getTrialId() {
        return trialId;
    }

    public void setTrialId(String trialId) {
        this.trialId = trialId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public TrialPhase getPhase() {
        return phase;
    }

    public void setPhase(TrialPhase phase) {
        this.phase = phase;
    }

    public TrialStatus getStatus() {
        return status;
    }

    public void setStatus(TrialStatus status) {
        this.status = status;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public String getIntervention() {
        return intervention;
    }

    public void setIntervention(String intervention) {
        this.intervention = intervention;
    }

    public String getSponsor() {
        return sponsor;
    }

    public void setSponsor(String sponsor) {
        this.sponsor = sponsor;
    }

    public Integer getEnrollment() {
        return enrollment;
    }

    public void setEnrollment(Integer enrollment) {
        this.enrollment = enrollment;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = startDate;
    }

    public Instant getCompletionDate() {
        return completionDate;
    }

    public void setCompletionDate(Instant completionDate) {
        this.completionDate = completionDate;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getPrimaryEndpoint() {
        return primaryEndpoint;
    }

    public void setPrimaryEndpoint(String primaryEndpoint) {
        this.primaryEndpoint = primaryEndpoint;
    }

    public List<String> getSecondaryEndpoints() {
        return secondaryEndpoints;
    }

    public void setSecondaryEndpoints(List<String> secondaryEndpoints) {
        this.secondaryEndpoints = secondaryEndpoints;
    }

    public String getEligibilityCriteria() {
        return eligibilityCriteria;
    }

    public void setEligibilityCriteria(String eligibilityCriteria) {
        this.eligibilityCriteria = eligibilityCriteria;
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public List<String> getMoleculeIds() {
        return moleculeIds;
    }

    public void setMoleculeIds(List<String> moleculeIds) {
        this.moleculeIds = moleculeIds;
    }
}
