package com.pharmos.graphql.analytics;

import java.util.List;

public class MoleculeAnalytics {

    private final int totalCount;
    private final Double averageMolecularWeight;
    private final Double averageLogP;
    private final int predictionsCount;
    private final int safetyEventsCount;
    private final List<CountByKey> byProject;

    public MoleculeAnalytics(int totalCount, Double averageMolecularWeight, Double averageLogP,
                             int predictionsCount, int safetyEventsCount, List<CountByKey> byProject) {
        this.totalCount = totalCount;
        this.averageMolecularWeight = averageMolecularWeight;
        this.averageLogP = averageLogP;
        this.predictionsCount = predictionsCount;
        this.safetyEventsCount = safetyEventsCount;
        this.byProject = byProject;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public Double getAverageMolecularWeight() {
        return averageMolecularWeight;
    }

    public Double getAverageLogP() {
        return averageLogP;
    }

    public int getPredictionsCount() {
        return predictionsCount;
    }

    public int getSafetyEventsCount() {
        return safetyEventsCount;
    }

    public List<CountByKey> getByProject() {
        return byProject;
    }
}
