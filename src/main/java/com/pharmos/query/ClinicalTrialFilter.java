package com.pharmos.query;

import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.TrialPhase;
import com.pharmos.domain.TrialStatus;

import java.time.Instant;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;
import static com.pharmos.query.Predicates.inRange;
import static com.pharmos.query.Predicates.memberIfSet;

/**
 * Filter input for clinical trial list queries.
 */
public class ClinicalTrialFilter implements EntityFilter<ClinicalTrial> {

    private TrialPhase phase;
    private TrialStatus status;
    private String condition;
    private String sponsor;
    private String projectId;
    private String moleculeId;
    private Integer minEnrollment;
    private Integer maxEnrollment;
    private Instant startAfter;
    private Instant startBefore;

    @Override
    public boolean matches(ClinicalTrial trial) {
        return equalsIfSet(phase, trial.getPhase())
            && equalsIfSet(status, trial.getStatus())
            && containsIfSet(condition, trial.getCondition())
            && containsIfSet(sponsor, trial.getSponsor())
            && equalsIfSet(projectId, trial.getProjectId())
            && memberIfSet(moleculeId, trial.getMoleculeIds())
            && inRange(trial.getEnrollment(), minEnrollment, maxEnrollment)
            && inRange(trial.getStartDate(), startAfter, startBefore);
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

    public String getSponsor() {
        return sponsor;
    }

    public void setSponsor(String sponsor) {
        this.sponsor = sponsor;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getMoleculeId() {
        return moleculeId;
    }

    public void setMoleculeId(String moleculeId) {
        this.moleculeId = moleculeId;
    }

    public Integer getMinEnrollment() {
        return minEnrollment;
    }

    public void setMinEnrollment(Integer minEnrollment) {
        this.minEnrollment = minEnrollment;
    }

    public Integer getMaxEnrollment() {
        return maxEnrollment;
    }

    public void setMaxEnrollment(Integer maxEnrollment) {
        this.maxEnrollment = maxEnrollment;
    }

    public Instant getStartAfter() {
        return startAfter;
    }

    public void setStartAfter(Instant startAfter) {
        this.startAfter = startAfter;
    }

    public Instant getStartBefore() {
        return startBefore;
    }

    public void setStartBefore(Instant startBefore) {
        this.startBefore = startBefore;
    }
}
