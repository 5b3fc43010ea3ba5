package com.pharmos.query;

import com.pharmos.domain.ResearchPaper;

import static com.pharmos.query.Predicates.anyContainsIfSet;
import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;
import static com.pharmos.query.Predicates.inRange;
import static com.pharmos.query.Predicates.memberIfSet;

/**
 * Filter input for research paper list queries.
 */
public class ResearchPaperFilter implements EntityFilter<ResearchPaper> {

    private String journal;
    private String author;
    private String keyword;
    private String projectId;
    private String moleculeId;
    private String clinicalTrialId;
    private Integer yearFrom;
    private Integer yearTo;
    private Integer minCitations;

    @Override
    public boolean matches(ResearchPaper paper) {
        return containsIfSet(journal, paper.getJournal())
            && anyContainsIfSet(author, paper.getAuthors())
            && anyContainsIfSet(keyword, paper.getKeywords())
            && equalsIfSet(projectId, paper.getProjectId())
            && memberIfSet(moleculeId, paper.getMoleculeIds())
            && memberIfSet(clinicalTrialId, paper.getClinicalTrialIds())
            && inRange(paper.getYear(), yearFrom, yearTo)
            && inRange(paper.getCitationCount(), minCitations, null);
    }

    public String getJournal() {
        return journal;
    }

    public void setJournal(String journal) {
        this.journal = journal;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getKeyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
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

    public String getClinicalTrialId() {
        return clinicalTrialId;
    }

    public void setClinicalTrialId(String clinicalTrialId) {
        this.clinicalTrialId = clinicalTrialId;
    }

    public Integer getYearFrom() {
        return yearFrom;
    }

    public void setYearFrom(Integer yearFrom) {
        this.yearFrom = yearFrom;
    }

    public Integer getYearTo() {
        return yearTo;
    }

    public void setYearTo(Integer yearTo) {
        this.yearTo = yearTo;
    }

    public Integer getMinCitations() {
        return minCitations;
    }

    public void setMinCitations(Integer minCitations) {
        this.minCitations = minCitations;
    }
}
