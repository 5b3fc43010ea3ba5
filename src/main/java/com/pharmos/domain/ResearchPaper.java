package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A published research paper with its bibliographic record and the molecules,
 * trials and project it is linked to.
 */
public class ResearchPaper extends BaseEntity {

    /**
     * PubMed identifier
     */
    @JsonProperty("pmid")
    private String pmid;

    @JsonProperty("title")
    private String title;

    private String abstractText;

    @JsonProperty("authors")
    private List<String> authors;

    @JsonProperty("journal")
    private String journal;

    @JsonProperty("year")
    private Integer year;

    @JsonProperty("doi")
    private String doi;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("citation_count")
    private Integer citationCount;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("molecule_ids")
    private List<String> moleculeIds;

    @JsonProperty("clinical_trial_ids")
    private List<String> clinicalTrialIds;

    public ResearchPaper() {
        this.authors = new ArrayList<>();
        this.keywords = new ArrayList<>();
        this.moleculeIds = new ArrayList<>();
        this.clinicalTrialIds = new ArrayList<>();
    }

    public String getPmid() {
        return pmid;
    }

    public void setPmid(String pmid) {
        this.pmid = pmid;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * Named for the GraphQL field {@code abstract}.
     */
    @JsonProperty("abstract")
    public String getAbstract() {
        return abstractText;
    }

    @JsonProperty("abstract")
    public void setAbstract(String abstractText) {
        this.abstractText = abstractText;
    }

    public List<String> getAuthors() {
        return authors;
    }

    public void setAuthors(List<String> authors) {
        this.authors = authors;
    }

    public String getJournal() {
        return journal;
    }

    public void setJournal(String journal) {
        this.journal = journal;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public Integer getCitationCount() {
        return citationCount;
    }

    public void setCitationCount(Integer citationCount) {
        this.citationCount = citationCount;
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

    public List<String> getClinicalTrialIds() {
        return clinicalTrialIds;
    }

    public void setClinicalTrialIds(List<String> clinicalTrialIds) {
        this.clinicalTrialIds = clinicalTrialIds;
    }
}
