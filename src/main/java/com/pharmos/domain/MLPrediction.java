package com.pharmos.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Output of one prediction model run against one molecule.
 */
public class MLPrediction extends BaseEntity {

    @JsonProperty("molecule_id")
    private String moleculeId;

    @JsonProperty("model_type")
    private ModelType modelType;

    @JsonProperty("model_version")
    private String modelVersion;

    /**
     * Model-specific value bag, exposed through the JSON scalar
     */
    @JsonProperty("predictions")
    private Map<String, Object> predictions;

    /**
     * Confidence score in [0, 1]
     */
    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("timestamp")
    private Instant timestamp;

    public MLPrediction() {
        this.predictions = new HashMap<>();
    }

    public String getMoleculeId() {
        return moleculeId;
    }

    public void setMoleculeId(String moleculeId) {
        this.moleculeId = moleculeId;
    }

    public ModelType getModelType() {
        return modelType;
    }

    public void setModelType(ModelType modelType) {
        this.modelType = modelType;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public Map<String, Object> getPredictions() {
        return predictions;
    }

    public void setPredictions(Map<String, Object> predictions) {
        this.predictions = predictions;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
