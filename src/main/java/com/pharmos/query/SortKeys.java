package com.pharmos.query;

import com.pharmos.domain.BaseEntity;
import com.pharmos.domain.ClinicalTrial;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.ResearchInsight;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.domain.SafetyEvent;
import com.pharmos.domain.User;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Sortable fields per entity type, keyed by their GraphQL field name.
 * Null values sort last in ascending order.
 */
public final class SortKeys {

    public static final Map<String, Comparator<User>> USER = build(
        new SortKeysBuilder<User>()
            .add("email", User::getEmail)
            .add("username", User::getUsername)
            .add("lastName", User::getLastName)
            .add("role", User::getRole)
            .add("department", User::getDepartment));

    public static final Map<String, Comparator<Molecule>> MOLECULE = build(
        new SortKeysBuilder<Molecule>()
            .add("name", Molecule::getName)
            .add("smiles", Molecule::getSmiles)
            .add("molecularWeight", Molecule::getMolecularWeight)
            .add("logP", Molecule::getLogP));

    public static final Map<String, Comparator<Project>> PROJECT = build(
        new SortKeysBuilder<Project>()
            .add("name", Project::getName)
            .add("status", Project::getStatus)
            .add("type", Project::getType)
            .add("startDate", Project::getStartDate)
            .add("endDate", Project::getEndDate)
            .add("budget", Project::getBudget)
            .add("progress", Project::getProgress));

    public static final Map<String, Comparator<ClinicalTrial>> CLINICAL_TRIAL = build(
        new SortKeysBuilder<ClinicalTrial>()
            .add("trialId", ClinicalTrial::getTrialId)
            .add("title", ClinicalTrial::getTitle)
            .add("phase", ClinicalTrial::getPhase)
            .add("status", ClinicalTrial::getStatus)
            .add("enrollment", ClinicalTrial::getEnrollment)
            .add("startDate", ClinicalTrial::getStartDate)
            .add("completionDate", ClinicalTrial::getCompletionDate));

    public static final Map<String, Comparator<ResearchPaper>> RESEARCH_PAPER = build(
        new SortKeysBuilder<ResearchPaper>()
            .add("title", ResearchPaper::getTitle)
            .add("journal", ResearchPaper::getJournal)
            .add("year", ResearchPaper::getYear)
            .add("citationCount", ResearchPaper::getCitationCount));

    public static final Map<String, Comparator<SafetyEvent>> SAFETY_EVENT = build(
        new SortKeysBuilder<SafetyEvent>()
            .add("eventId", SafetyEvent::getEventId)
            .add("drugName", SafetyEvent::getDrugName)
            .add("severity", SafetyEvent::getSeverity)
            .add("outcome", SafetyEvent::getOutcome)
            .add("reportedDate", SafetyEvent::getReportedDate));

    public static final Map<String, Comparator<MLPrediction>> ML_PREDICTION = build(
        new SortKeysBuilder<MLPrediction>()
            .add("modelType", MLPrediction::getModelType)
            .add("confidence", MLPrediction::getConfidence)
            .add("timestamp", MLPrediction::getTimestamp));

    public static final Map<String, Comparator<ResearchInsight>> RESEARCH_INSIGHT = build(
        new SortKeysBuilder<ResearchInsight>()
            .add("topic", ResearchInsight::getTopic)
            .add("confidenceScore", ResearchInsight::getConfidenceScore)
            .add("generatedDate", ResearchInsight::getGeneratedDate));

    private SortKeys() {
    }

    private static <T extends BaseEntity> Map<String, Comparator<T>> build(SortKeysBuilder<T> builder) {
        builder.add("id", BaseEntity::getId)
            .add("createdAt", BaseEntity::getCreatedAt)
            .add("updatedAt", BaseEntity::getUpdatedAt);
        return Collections.unmodifiableMap(builder.keys);
    }

    private static final class SortKeysBuilder<T> {
        private final Map<String, Comparator<T>> keys = new LinkedHashMap<>();

        <U extends Comparable<? super U>> SortKeysBuilder<T> add(String field, Function<? super T, ? extends U> extractor) {
            keys.put(field, Comparator.comparing(extractor, Comparator.nullsLast(Comparator.naturalOrder())));
            return this;
        }
    }
}
