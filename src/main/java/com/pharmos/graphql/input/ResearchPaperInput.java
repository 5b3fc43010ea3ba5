package com.pharmos.graphql.input;

import com.pharmos.domain.ResearchPaper;

import java.util.List;

import static com.pharmos.graphql.input.Inputs.copyOf;
import static com.pharmos.graphql.input.Inputs.requireBetween;
import static com.pharmos.graphql.input.Inputs.requireNonNegative;
import static com.pharmos.graphql.input.Inputs.requireText;
import static com.pharmos.graphql.input.Inputs.setIfPresent;

/**
 * Research paper fields accepted by create and update mutations.
 */
public class ResearchPaperInput {

    private String pmid;
    private String title;
    private String abstractText;
    private List<String> authors;
    private String journal;
    private Integer year;
    private String doi;
    private List<String> keywords;
    private Integer citationCount;
    private String projectId;
    private List<String> moleculeIds;
    private List<String> clinicalTrialIds;

    public void validateForCreate() {
        requireText(title, "title");
        validateForUpdate();
    }

    public void validateForUpdate() {
        if (title != null) {
            requireText(title, "title");
        }
        requireBetween(year, 1800, 2100, "year");
        requireNonNegative(citationCount, "citationCount");
    }

    public ResearchPaper toEntity() {
        ResearchPaper paper = new ResearchPaper();
        paper.setPmid(pmid);
        paper.setTitle(title.trim());
        paper.setAbstract(abstractText);
        paper.setAuthors(copyOf(authors));
        paper.setJournal(journal);
        paper.setYear(year);
        paper.setDoi(doi);
        paper.setKeywords(copyOf(keywords));
        paper.setCitationCount(citationCount != null ? citationCount : 0);
        paper.setProjectId(projectId);
        paper.setMoleculeIds(copyOf(moleculeIds));
        paper.setClinicalTrialIds(copyOf(clinicalTrialIds));
        return paper;
    }

    public void applyTo(ResearchPaper paper) {
        setIfPresent(pmid, paper::setPmid);
        setIfPresent(title != null ? title.trim() : null, paper::setTitle);
        setIfPresent(abstractText, paper::setAbstract);
        setIfPresent(authors, value -> paper.setAuthors(copyOf(value)));
        setIfPresent(journal, paper::setJournal);
        setIfPresent(year, paper::setYear);
        setIfPresent(doi, paper::setDoi);
        setIfPresent(keywords, value -> paper.setKeywords(copyOf(value)));
        setIfPresent(citationCount, paper::setCitationCount);
        setIfPresent(projectId, paper::setProjectId);
        setIfPresent(moleculeIds, value -> paper.setMoleculeIds(copyOf(value)));
        setIfPresent(clinicalTrialIds, value -> paper.setClinicalTrialIds(copyOf(value)));
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

    public String getAbstract() {
        return abstractText;
    }

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
