package com.pharmos.query;

import com.pharmos.domain.Outcome;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.Severity;

import java.time.Instant;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;
import static com.pharmos.query.Predicates.inRange;

/**
 * Filter input for safety event list queries.
 */
public class SafetyEventFilter implements EntityFilter<SafetyEvent> {

    private Severity severity;
    private Outcome outcome;
    private String drugName;
    private String eventType;
    private String moleculeId;
    private String clinicalTrialId;
    private Instant reportedAfter;
    private Instant reportedBefore;

    @Override
    public boolean matches(SafetyEvent event) {
        return equalsIfSet(severity, event.getSeverity())
            && equalsIfSet(outcome, event.getOutcome())
            && containsIfSet(drugName, event.getDrugName())
            && containsIfSet(eventType, event.getEventType())
            && equalsIfSet(moleculeId, event.getMoleculeId())
            && equalsIfSet(clinicalTrialId, event.getClinicalTrialId())
            && inRange(event.getReportedDate(), reportedAfter, reportedBefore);
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public String getDrugName() {
        return drugName;
    }

    public void setDrugName(String drugName) {
        this.drugName = drugName;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getMoleculeId() {
        return moleculeId;
    }

    public void setMoleculeId(String moleculeId) {
        this.moleculeId = moleculeId;
    }

    public String getClinicalTrialId() {
        return clinicalTrialId;
    }

    public void setClinicalTrialId(String clinicalTrialId) {
        this.clinicalTrialId = clinicalTrialId;
    }

    public Instant getReportedAfter() {
        return reportedAfter;
    }

    public void setReportedAfter(Instant reportedAfter) {
        this.reportedAfter = reportedAfter;
    }

    public Instant getReportedBefore() {
        return reportedBefore;
    }

    public void setReportedBefore(Instant reportedBefore) {
        this.reportedBefore = reportedBefore;
    }
}
