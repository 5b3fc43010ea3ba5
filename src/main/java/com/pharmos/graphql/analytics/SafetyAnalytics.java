package com.pharmos.graphql.analytics;

import java.util.List;

/**
 * Adverse event counts. Age buckets are decades ("60-69"); events without an
 * age are left out of {@code byAgeGroup}.
 */
public class SafetyAnalytics {

    private final int totalEvents;
    private final List<CountByKey> bySeverity;
    private final List<CountByKey> byOutcome;
    private final List<CountByKey> byEventType;
    private final List<CountByKey> byAgeGroup;
    private final List<CountByKey> byGender;

    public SafetyAnalytics(int totalEvents, List<CountByKey> bySeverity, List<CountByKey> byOutcome,
                           List<CountByKey> byEventType, List<CountByKey> byAgeGroup, List<CountByKey> byGender) {
        this.totalEvents = totalEvents;
        this.bySeverity = bySeverity;
        this.byOutcome = byOutcome;
        this.byEventType = byEventType;
        this.byAgeGroup = byAgeGroup;
        this.byGender = byGender;
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public List<CountByKey> getBySeverity() {
        return bySeverity;
    }

    public List<CountByKey> getByOutcome() {
        return byOutcome;
    }

    public List<CountByKey> getByEventType() {
        return byEventType;
    }

    public List<CountByKey> getByAgeGroup() {
        return byAgeGroup;
    }

    public List<CountByKey> getByGender() {
        return byGender;
    }
}
