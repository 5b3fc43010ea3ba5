package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.Project;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

@Repository
public class ProjectRepository extends InMemoryRepository<Project> {

    public ProjectRepository(ObjectMapper objectMapper) {
        super(objectMapper, Project.class, "proj");
    }

    /**
     * A project belongs to a user through its lead and its team.
     */
    @Override
    protected Collection<String> parentIds(Project project, Relation relation) {
        if (relation == Relation.USER) {
            Set<String> members = new LinkedHashSet<>(project.getTeamIds());
            if (project.getLeadId() != null) {
                members.add(project.getLeadId());
            }
            return members;
        }
        throw unsupported(relation);
    }
}
