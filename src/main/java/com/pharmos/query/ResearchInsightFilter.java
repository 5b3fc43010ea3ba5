package com.pharmos.query;

import com.pharmos.domain.ResearchInsight;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.inRange;
import static com.pharmos.query.Predicates.memberIfSet;

/**
 * Filter input for research insight list queries.
 */
public class ResearchInsightFilter implements EntityFilter<ResearchInsight> {

    private String topic;
    private String paperId;
    private Double minConfidence;

    @Override
    public boolean matches(ResearchInsight insight) {
        return containsIfSet(topic, insight.getTopic())
            && memberIfSet(paperId, insight.getRelatedPaperIds())
            && inRange(insight.getConfidenceScore(), minConfidence, null);
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getPaperId() {
        return paperId;
    }

    public void setPaperId(String paperId) {
        this.paperId = paperId;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }
}
