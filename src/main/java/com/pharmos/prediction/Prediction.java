package com.pharmos.prediction;

import java.util.Collections;
import java.util.Map;

/**
 * Result of one provider call: a value bag, a confidence in [0, 1] and the
 * version of the model that produced it.
 */
public class Prediction {

    private final Map<String, Object> values;
    private final double confidence;
    private final String modelVersion;

    public Prediction(Map<String, Object> values, double confidence, String modelVersion) {
        this.values = Collections.unmodifiableMap(values);
        this.confidence = confidence;
        this.modelVersion = modelVersion;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getModelVersion() {
        return modelVersion;
    }
}
