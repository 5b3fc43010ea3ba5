package com.pharmos.graphql.analytics;

import java.util.List;

public class ProjectAnalytics {

    private final int totalCount;
    private final List<CountByKey> byStatus;
    private final List<CountByKey> byType;
    private final double totalBudget;
    private final Double averageProgress;

    public ProjectAnalytics(int totalCount, List<CountByKey> byStatus, List<CountByKey> byType,
                            double totalBudget, Double averageProgress) {
        this.totalCount = totalCount;
        this.byStatus = byStatus;
        this.byType = byType;
        this.totalBudget = totalBudget;
        this.averageProgress = averageProgress;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public List<CountByKey> getByStatus() {
        return byStatus;
    }

    public List<CountByKey> getByType() {
        return byType;
    }

    public double getTotalBudget() {
        return totalBudget;
    }

    public Double getAverageProgress() {
        return averageProgress;
    }
}
