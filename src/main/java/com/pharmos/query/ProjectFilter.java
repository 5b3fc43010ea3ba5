package com.pharmos.query;

import com.pharmos.domain.Project;
import com.pharmos.domain.ProjectStatus;
import com.pharmos.domain.ProjectType;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;
import static com.pharmos.query.Predicates.inRange;
import static com.pharmos.query.Predicates.memberIfSet;

/**
 * Filter input for project list queries.
 */
public class ProjectFilter implements EntityFilter<Project> {

    private ProjectStatus status;
    private ProjectType type;
    private String name;
    private String leadId;
    private String memberId;
    private String tag;
    private Double minBudget;
    private Double maxBudget;

    public ProjectFilter() {
    }

    public ProjectFilter(ProjectStatus status, ProjectType type) {
        this.status = status;
        this.type = type;
    }

    @Override
    public boolean matches(Project project) {
        return equalsIfSet(status, project.getStatus())
            && equalsIfSet(type, project.getType())
            && containsIfSet(name, project.getName())
            && equalsIfSet(leadId, project.getLeadId())
            && (memberId == null || project.hasMember(memberId))
            && memberIfSet(tag, project.getTags())
            && inRange(project.getBudget(), minBudget, maxBudget);
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLeadId() {
        return leadId;
    }

    public void setLeadId(String leadId) {
        this.leadId = leadId;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public Double getMinBudget() {
        return minBudget;
    }

    public void setMinBudget(Double minBudget) {
        this.minBudget = minBudget;
    }

    public Double getMaxBudget() {
        return maxBudget;
    }

    public void setMaxBudget(Double maxBudget) {
        this.maxBudget = maxBudget;
    }
}
