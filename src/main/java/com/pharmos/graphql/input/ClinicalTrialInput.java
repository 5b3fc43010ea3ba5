package com.pharmos.graphql.input;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.TrialPhase;
import com.pharmos.domain.TrialStatus;
import com.pharmos.graphql.GraphQLException;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

import static com.pharmos.graphql.input.Inputs.copyOf;
import static com.pharmos.graphql.input.Inputs.requireNonNegative;
import static com.pharmos.graphql.input.Inputs.requirePresent;
import static com.pharmos.graphql.input.Inputs.requireText;
import static com.pharmos.graphql.input.Inputs.setIfPresent;

/**
 * Clinical trial fields accepted by create and update mutations.
 */
public class ClinicalTrialInput {

    // ClinicalTrials.gov registry number
    private static final Pattern TRIAL_ID_PATTERN = Pattern.compile("^NCT\\d{8}$");

    private String trialId;
    private String title;
    private TrialPhase phase;
    private TrialStatus status;
    private String condition;
    private String intervention;
    private String sponsor;
    private Integer enrollment;
    private Instant startDate;
    private Instant completionDate;
    private String description;
    private String primaryEndpoint;
    private List<String> secondaryEndpoints;
    private String eligibilityCriteria;
    private List<String> locations;
    private String projectId;
    private List<String> moleculeIds;

    public void validateForCreate() {
        requireText(trialId, "trialId");
        requireText(title, "title");
        requirePresent(phase, "phase");
        validateForUpdate();
    }

    public void validateForUpdate() {
        if (trialId != null && !TRIAL_ID_PATTERN.matcher(trialId.trim()).matches()) {
            throw GraphQLException.invalidInput("trialId must look like NCT followed by 8 digits: " + trialId);
        }
        if (title != null) {
            requireText(title, "title");
        }
        requireNonNegative(enrollment, "enrollment");
        if (startDate != null && completionDate != null && completionDate.isBefore(startDate)) {
            throw GraphQLException.invalidInput("completionDate must not be before startDate");
        }
    }

    public ClinicalTrial toEntity() {
        ClinicalTrial trial = new ClinicalTrial();
        trial.setTrialId(trialId.trim());
        trial.setTitle(title.trim());
        trial.setPhase(phase);
        trial.setStatus(status != null ? status : TrialStatus.NOT_YET_RECRUITING);
        trial.setCondition(condition);
        trial.setIntervention(intervention);
        trial.setSponsor(sponsor);
        trial.setEnrollment(enrollment);
        trial.setStartDate(startDate);
        trial.setCompletionDate(completionDate);
        trial.setDescription(description);
        trial.setPrimaryEndpoint(primaryEndpoint);
        trial.setSecondaryEndpoints(copyOf(secondaryEndpoints));
        trial.setEligibilityCriteria(eligibilityCriteria);
        trial.setLocations(copyOf(locations));
        trial.setProjectId(projectId);
        trial.setMoleculeIds(copyOf(moleculeIds));
        return trial;
    }

    public void applyTo(ClinicalTrial trial) {
        setIfPresent(trialId != null ? trialId.trim() : null, trial::setTrialId);
        setIfPresent(title != null ? title.trim() : null, trial::setTitle);
        setIfPresent(phase, trial::setPhase);
        setIfPresent(status, trial::setStatus);
        setIfPresent(condition, trial::setCondition);
        setIfPresent(intervention, trial::setIntervention);
        setIfPresent(sponsor, trial::setSponsor);
        setIfPresent(enrollment, trial::setEnrollment);
        setIfPresent(startDate, trial::setStartDate);
        setIfPresent(completionDate, trial::setCompletionDate);
        setIfPresent(description, trial::setDescription);
        setIfPresent(primaryEndpoint, trial::setPrimaryEndpoint);
        setIfPresent(secondaryEndpoints, value -> trial.setSecondaryEndpoints(copyOf(value)));
        setIfPresent(eligibilityCriteria, trial::setEligibilityCriteria);
        setIfPresent(locations, value -> trial.setLocations(copyOf(value)));
        setIfPresent(projectId, trial::setProjectId);
        setIfPresent(moleculeIds, value -> trial.setMoleculeIds(copyOf(value)));
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
