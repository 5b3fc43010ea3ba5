package com.pharmos.storage;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.BaseEntity;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Fills the in-memory repositories from {@code classpath:seed/*.json} at startup.
 *
 * Disabled with {@code pharmos.seed.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "pharmos.seed.enabled", havingValue = "true", matchIfMissing = true)
public class SeedDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(SeedDataLoader.class);

    private final ObjectMapper objectMapper;
    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final MoleculeRepository moleculeRepository;
    private final ClinicalTrialRepository clinicalTrialRepository;
    private final ResearchPaperRepository researchPaperRepository;
    private final SafetyEventRepository safetyEventRepository;
    private final MLPredictionRepository mlPredictionRepository;
    private final ResearchInsightRepository researchInsightRepository;

    public SeedDataLoader(
            ObjectMapper objectMapper,
            UserRepository userRepository,
            ProjectRepository projectRepository,
            MoleculeRepository moleculeRepository,
            ClinicalTrialRepository clinicalTrialRepository,
            ResearchPaperRepository researchPaperRepository,
            SafetyEventRepository safetyEventRepository,
            MLPredictionRepository mlPredictionRepository,
            ResearchInsightRepository researchInsightRepository) {
        this.objectMapper = objectMapper;
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.moleculeRepository = moleculeRepository;
        this.clinicalTrialRepository = clinicalTrialRepository;
        this.researchPaperRepository = researchPaperRepository;
        this.safetyEventRepository = safetyEventRepository;
        this.mlPredictionRepository = mlPredictionRepository;
        this.researchInsightRepository = researchInsightRepository;
    }

    @PostConstruct
    public void load() {
        seed(userRepository, "seed/users.json");
        seed(projectRepository, "seed/projects.json");
        seed(moleculeRepository, "seed/molecules.json");
        seed(clinicalTrialRepository, "seed/clinical-trials.json");
        seed(researchPaperRepository, "seed/research-papers.json");
        seed(safetyEventRepository, "seed/safety-events.json");
        seed(mlPredictionRepository, "seed/ml-predictions.json");
        seed(researchInsightRepository, "seed/research-insights.json");
    }

    private <T extends BaseEntity> void seed(InMemoryRepository<T> repository, String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            logger.warn("Seed resource {} not found, {} store starts empty",
                path, repository.getEntityType().getSimpleName());
            return;
        }
        JavaType listType = objectMapper.getTypeFactory()
            .constructCollectionType(List.class, repository.getEntityType());
        try (InputStream in = resource.getInputStream()) {
            List<T> entities = objectMapper.readValue(in, listType);
            repository.seed(entities);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed resource " + path, e);
        }
    }
}
