package com.pharmos.graphql.analytics;

import java.util.List;

public class ClinicalTrialAnalytics {

    private final int totalCount;
    private final List<CountByKey> byPhase;
    private final List<CountByKey> byStatus;
    private final List<CountByKey> byCondition;
    private final long totalEnrollment;

    public ClinicalTrialAnalytics(int totalCount, List<CountByKey> byPhase, List<CountByKey> byStatus,
                                  List<CountByKey> byCondition, long totalEnrollment) {
        this.totalCount = totalCount;
        this.byPhase = byPhase;
        this.byStatus = byStatus;
        this.byCondition = byCondition;
        this.totalEnrollment = totalEnrollment;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public List<CountByKey> getByPhase() {
        return byPhase;
    }

    public List<CountByKey> getByStatus() {
        return byStatus;
    }

    public List<CountByKey> getByCondition() {
        return byCondition;
    }

    public long getTotalEnrollment() {
        return totalEnrollment;
    }
}
