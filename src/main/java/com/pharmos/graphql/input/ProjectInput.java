package com.pharmos.graphql.input;

import com.pharmos.domain.Project;
import com.pharmos.domain.ProjectStatus;
import com.pharmos.domain.ProjectType;
import com.pharmos.graphql.GraphQLException;

import java.time.Instant;
import java.util.List;

import static com.pharmos.graphql.input.Inputs.copyOf;
import static com.pharmos.graphql.input.Inputs.requireBetween;
import static com.pharmos.graphql.input.Inputs.requireNonNegative;
import static com.pharmos.graphql.input.Inputs.requirePresent;
import static com.pharmos.graphql.input.Inputs.requireText;
import static com.pharmos.graphql.input.Inputs.setIfPresent;

/**
 * Project fields accepted by create and update mutations.
 */
public class ProjectInput {

    private String name;
    private String description;
    private ProjectStatus status;
    private ProjectType type;
    private Instant startDate;
    private Instant endDate;
    private Double budget;
    private Double progress;
    private String leadId;
    private List<String> teamIds;
    private List<String> milestones;
    private List<String> tags;

    public void validateForCreate() {
        requireText(name, "name");
        requirePresent(type, "type");
        validateForUpdate();
    }

    public void validateForUpdate() {
        if (name != null) {
            requireText(name, "name");
        }
        requireNonNegative(budget, "budget");
        requireBetween(progress, 0, 100, "progress");
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw GraphQLException.invalidInput("endDate must not be before startDate");
        }
    }

    /**
     * @param defaultLeadId lead used when the input names none, normally the caller
     */
    public Project toEntity(String defaultLeadId) {
        Project project = new Project();
        project.setName(name.trim());
        project.setDescription(description);
        project.setStatus(status != null ? status : ProjectStatus.PLANNING);
        project.setType(type);
        project.setStartDate(startDate);
        project.setEndDate(endDate);
        project.setBudget(budget);
        project.setProgress(progress != null ? progress : 0.0);
        project.setLeadId(leadId != null ? leadId : defaultLeadId);
        project.setTeamIds(copyOf(teamIds));
        project.setMilestones(copyOf(milestones));
        project.setTags(copyOf(tags));
        return project;
    }

    public void applyTo(Project project) {
        setIfPresent(name != null ? name.trim() : null, project::setName);
        setIfPresent(description, project::setDescription);
        setIfPresent(status, project::setStatus);
        setIfPresent(type, project::setType);
        setIfPresent(startDate, project::setStartDate);
        setIfPresent(endDate, project::setEndDate);
        setIfPresent(budget, project::setBudget);
        setIfPresent(progress, project::setProgress);
        setIfPresent(leadId, project::setLeadId);
        setIfPresent(teamIds, value -> project.setTeamIds(copyOf(value)));
        setIfPresent(milestones, value -> project.setMilestones(copyOf(value)));
        setIfPresent(tags, value -> project.setTags(copyOf(value)));
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

    public Double getProgress() {
        return progress;
    }

    public void setProgress(Double progress) {
        this.progress = progress;
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
