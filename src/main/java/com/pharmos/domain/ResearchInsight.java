package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A summary generated from a set of research papers on one topic.
 */
public class ResearchInsight extends BaseEntity {

    @JsonProperty("insight_id")
    private String insightId;

    @JsonProperty("topic")
    private String topic;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("key_findings")
    private List<String> keyFindings;

    @JsonProperty("papers_analyzed")
    private Integer papersAnalyzed;

    @JsonProperty("confidence_score")
    private Double confidenceScore;

    @JsonProperty("generated_date")
    private Instant generatedDate;

    @JsonProperty("recommendations")
    private List<String> recommendations;

    @JsonProperty("related_paper_ids")
    private List<String> relatedPaperIds;

    public ResearchInsight() {
        this.keyFindings = new ArrayList<>();
        this.recommendations = new ArrayList<>();
        this.relatedPaperIds = new ArrayList<>();
    }

    public String getInsightId() {
        return insightId;
    }

    public void setInsightId(String insightId) {
        this.insightId = insightId;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<String> getKeyFindings() {
        return keyFindings;
    }

    public void setKeyFindings(List<String> keyFindings) {
        this.keyFindings = keyFindings;
    }

    public Integer getPapersAnalyzed() {
        return papersAnalyzed;
    }

    public void setPapersAnalyzed(Integer papersAnalyzed) {
        this.papersAnalyzed = papersAnalyzed;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(Double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public Instant getGeneratedDate() {
        return generatedDate;
    }

    public void setGeneratedDate(Instant generatedDate) {
        this.generatedDate = generatedDate;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations;
    }

    public List<String> getRelatedPaperIds() {
        return relatedPaperIds;
    }

    public void setRelatedPaperIds(List<String> relatedPaperIds) {
        this.relatedPaperIds = relatedPaperIds;
    }
}
