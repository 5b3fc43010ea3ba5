package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An adverse event reported against a molecule, optionally within a clinical trial.
 */
public class SafetyEvent extends BaseEntity {

    /**
     * Pharmacovigilance case number, e.g. AE-2024-0001
     */
    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("drug_name")
    private String drugName;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("severity")
    private Severity severity;

    @JsonProperty("outcome")
    private Outcome outcome;

    @JsonProperty("patient_age")
    private Integer patientAge;

    @JsonProperty("gender")
    private String gender;

    @JsonProperty("reported_date")
    private Instant reportedDate;

    @JsonProperty("description")
    private String description;

    @JsonProperty("molecule_id")
    private String moleculeId;

    @JsonProperty("clinical_trial_id")
    private String clinicalTrialId;

    @JsonProperty("reported_by_id")
    private String reportedById;

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

    public String getReportedById() {
        return reportedById;
    }

    public void setReportedById(String reportedById) {
        this.reportedById = reportedById;
    }
}
