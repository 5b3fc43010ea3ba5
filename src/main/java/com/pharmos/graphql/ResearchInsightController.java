package com.pharmos.graphql;

import com.pharmos.domain.ResearchInsight;
import com.pharmos.domain.ResearchPaper;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.Inputs;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.ResearchInsightFilter;
import com.pharmos.query.SortKeys;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.ResearchInsightRepository;
import com.pharmos.storage.ResearchPaperRepository;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * GraphQL controller for research insights.
 *
 * {@code generateInsight} summarises a set of stored papers: findings are the
 * keywords shared by most of them, confidence grows with the number of papers.
 */
@Controller
public class ResearchInsightController {
    private static final Logger logger = LoggerFactory.getLogger(ResearchInsightController.class);

    static final int MAX_KEY_FINDINGS = 5;

    private final ResearchInsightRepository insightRepository;
    private final ResearchPaperRepository paperRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;
    private final ActivityFeed activityFeed;

    public ResearchInsightController(
            ResearchInsightRepository insightRepository,
            ResearchPaperRepository paperRepository,
            Paginator paginator,
            AccessGuard accessGuard,
            ActivityFeed activityFeed) {
        this.insightRepository = insightRepository;
        this.paperRepository = paperRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
        this.activityFeed = activityFeed;
    }

    @QueryMapping
    public CompletableFuture<ResearchInsight> researchInsight(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.RESEARCH_INSIGHT_BY_ID, id);
    }

    @QueryMapping
    public Paginated<ResearchInsight> researchInsights(
            @Argument ResearchInsightFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        return paginator.paginate(insightRepository.findAll(filter), pagination, SortKeys.RESEARCH_INSIGHT);
    }

    @MutationMapping
    public ResearchInsight generateInsight(
            @Argument String topic,
            @Argument List<String> paperIds,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireIdentity(identity);
        String insightTopic = Inputs.requireText(topic, "topic");
        if (paperIds == null || paperIds.isEmpty()) {
            throw GraphQLException.invalidInput("paperIds must name at least one paper");
        }
        List<String> distinctIds = new ArrayList<>(new LinkedHashSet<>(paperIds));
        List<ResearchPaper> papers = paperRepository.findByIds(distinctIds);
        for (int i = 0; i < papers.size(); i++) {
            if (papers.get(i) == null) {
                throw GraphQLException.invalidInput("Unknown research paper: " + distinctIds.get(i));
            }
        }

        Instant now = Instant.now();
        ResearchInsight insight = new ResearchInsight();
        insight.setInsightId("INS-" + now.toEpochMilli());
        insight.setTopic(insightTopic);
        insight.setPapersAnalyzed(papers.size());
        insight.setKeyFindings(keyFindings(papers));
        insight.setSummary("Analysis of " + papers.size() + " paper(s) on " + insightTopic
            + (papers.size() == 1 ? ": " + papers.get(0).getTitle() : ""));
        insight.setConfidenceScore(Math.min(0.95, 0.5 + 0.1 * papers.size()));
        insight.setRecommendations(recommendations(papers));
        insight.setGeneratedDate(now);
        insight.setRelatedPaperIds(distinctIds);

        ResearchInsight created = insightRepository.create(insight);
        logger.info("Insight {} on '{}' generated from {} papers by {}",
            created.getId(), insightTopic, papers.size(), identity.getId());

        activityFeed.publish(Topic.RESEARCH_INSIGHT_GENERATED, created, created.getId(), null, identity,
            "Insight generated on " + insightTopic);
        return created;
    }

    @SchemaMapping(typeName = "ResearchInsight", field = "relatedPapers")
    public CompletableFuture<List<ResearchPaper>> relatedPapers(ResearchInsight insight, DataFetchingEnvironment env) {
        return Loaders.loadMany(env, Loaders.RESEARCH_PAPER_BY_ID, insight.getRelatedPaperIds());
    }

    /**
     * Keywords ordered by how many papers mention them, ties in first-seen order.
     */
    static List<String> keyFindings(List<ResearchPaper> papers) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ResearchPaper paper : papers) {
            for (String keyword : new LinkedHashSet<>(paper.getKeywords())) {
                counts.merge(keyword.toLowerCase(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(MAX_KEY_FINDINGS)
            .map(entry -> entry.getKey() + " (" + entry.getValue() + " of " + papers.size() + " papers)")
            .collect(Collectors.toList());
    }

    private static List<String> recommendations(List<ResearchPaper> papers) {
        List<String> recommendations = new ArrayList<>();
        int latestYear = papers.stream()
            .filter(paper -> paper.getYear() != null)
            .mapToInt(ResearchPaper::getYear)
            .max()
            .orElse(0);
        if (latestYear > 0) {
            recommendations.add("Review literature published after " + latestYear);
        }
        if (papers.size() < 3) {
            recommendations.add("Include more papers to strengthen the analysis");
        }
        return recommendations;
    }
}
