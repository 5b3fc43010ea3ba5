package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A research or development project. Owns molecules, clinical trials and papers
 * through their project references, and a team of users through {@link #teamIds}.
 */
public class Project extends BaseEntity {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("status")
    private ProjectStatus status;

    @JsonProperty("type")
    private ProjectType type;

    @JsonProperty("start_date")
    private Instant startDate;

    @JsonProperty("end_date")
    private Instant endDate;

    @JsonProperty("budget")
    private Double budget;

    @JsonProperty("lead_id")
    private String leadId;

    @JsonProperty("team_ids")
    private List<String> teamIds;

    /**
     * Completion percentage, 0-100
     */
    @JsonProperty("progress")
    private Double progress;

    @JsonProperty("milestones")
    private List<String> milestones;

    @JsonProperty("tags")
    private List<String> tags;

    public Project() {
        this.teamIds = new ArrayList<>();
        this.milestones = new ArrayList<>();
        this.tags = new ArrayList<>();
        this.progress = 0.0;
    }

    /**
     * @return true if the user leads the project or is on its team
     */
    public boolean hasMember(String userId) {
        return userId != null && (userId.equals(leadId) || teamIds.contains(userId));
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ProjectStatus getStatus() {
        return status;
    }

    public void setStatus(ProjectStatus status) {
        this.status = status;
    }

    public ProjectType getType() {
        return type;
    }

    public void setType(ProjectType type) {
        this.type = type;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = endDate;
    }

    public Double getBudget() {
        return budget;
    }

    public void setBudget(Double budget) {
        this.budget = budget;
    }

    public String getLeadId() {
        return leadId;
    }

    public void setLeadId(String leadId) {
        this.leadId = leadId;
    }

    public List<String> getTeamIds() {
        return teamIds;
    }

    public void setTeamIds(List<String> teamIds) {
        this.teamIds = teamIds;
    }

    public Double getProgress() {
        return progress;
    }

    public void setProgress(Double progress) {
        this.progress = progress;
    }

    public List<String> getMilestones() {
        return milestones;
    }

    public void setMilestones(List<String> milestones) {
        this.milestones = milestones;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }
}
