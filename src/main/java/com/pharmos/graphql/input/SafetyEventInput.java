package com.pharmos.graphql.input;

import com.pharmos.domain.Outcome;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.Severity;

import java.time.Instant;

import static com.pharmos.graphql.input.Inputs.requireBetween;
import static com.pharmos.graphql.input.Inputs.requirePresent;
import static com.pharmos.graphql.input.Inputs.requireText;
import static com.pharmos.graphql.input.Inputs.setIfPresent;

/**
 * Safety event fields accepted by create and update mutations.
 */
public class SafetyEventInput {

    private String eventId;
    private String drugName;
    private String eventType;
    private Severity severity;
    private Outcome outcome;
    private Integer patientAge;
    private String gender;
    private Instant reportedDate;
    private String description;
    private String moleculeId;
    private String clinicalTrialId;

    public void validateForCreate() {
        requireText(drugName, "drugName");
        requireText(eventType, "eventType");
        requirePresent(severity, "severity");
        validateForUpdate();
    }

    public void validateForUpdate() {
        if (drugName != null) {
            requireText(drugName, "drugName");
        }
        if (eventType != null) {
            requireText(eventType, "eventType");
        }
        requireBetween(patientAge, 0, 130, "patientAge");
    }

    /**
     * @param reporterId user filing the report
     */
    public SafetyEvent toEntity(String reporterId) {
        SafetyEvent event = new SafetyEvent();
        event.setEventId(eventId);
        event.setDrugName(drugName.trim());
        event.setEventType(eventType.trim());
        event.setSeverity(severity);
        event.setOutcome(outcome != null ? outcome : Outcome.UNKNOWN);
        event.setPatientAge(patientAge);
        event.setGender(gender);
        event.setReportedDate(reportedDate != null ? reportedDate : Instant.now());
        event.setDescription(description);
        event.setMoleculeId(moleculeId);
        event.setClinicalTrialId(clinicalTrialId);
        event.setReportedById(reporterId);
        return event;
    }

    public void applyTo(SafetyEvent event) {
        setIfPresent(eventId, event::setEventId);
        setIfPresent(drugName != null ? drugName.trim() : null, event::setDrugName);
        setIfPresent(eventType != null ? eventType.trim() : null, event::setEventType);
        setIfPresent(severity, event::setSeverity);
        setIfPresent(outcome, event::setOutcome);
        setIfPresent(patientAge, event::setPatientAge);
        setIfPresent(gender, event::setGender);
        setIfPresent(reportedDate, event::setReportedDate);
        setIfPresent(description, event::setDescription);
        setIfPresent(moleculeId, event::setMoleculeId);
        setIfPresent(clinicalTrialId, event::setClinicalTrialId);
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
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

    public Integer getPatientAge() {
        return patientAge;
    }

    public void setPatientAge(Integer patientAge) {
        this.patientAge = patientAge;
    }

    public String getGender() {
        return gender;
    }

    public void setGender(String gender) {
        this.gender = gender;
    }

    public Instant getReportedDate() {
        return reportedDate;
    }

    public void setReportedDate(Instant reportedDate) {
        this.reportedDate = reportedDate;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
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
}
