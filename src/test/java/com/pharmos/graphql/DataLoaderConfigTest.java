package com.pharmos.graphql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.ModelType;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.storage.ClinicalTrialRepository;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import com.pharmos.storage.Relation;
import com.pharmos.storage.ResearchInsightRepository;
import com.pharmos.storage.ResearchPaperRepository;
import com.pharmos.storage.SafetyEventRepository;
import com.pharmos.storage.UserRepository;
import graphql.GraphQLContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.graphql.execution.DefaultBatchLoaderRegistry;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the request-scoped data loaders.
 *
 * Each test builds a fresh {@link DataLoaderRegistry}, the same way one GraphQL
 * request does, and checks how many repository calls the loads turn into.
 */
class DataLoaderConfigTest {

    private MoleculeRepository moleculeRepository;
    private MLPredictionRepository predictionRepository;
    private ProjectRepository projectRepository;
    private DataLoaderMetrics metrics;
    private DataLoaderRegistry dataLoaders;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        moleculeRepository = spy(new MoleculeRepository(mapper));
        predictionRepository = spy(new MLPredictionRepository(mapper));
        projectRepository = spy(new ProjectRepository(mapper));
        metrics = new DataLoaderMetrics(new SimpleMeterRegistry());

        for (String name : Arrays.asList("Aspirin", "Ibuprofen", "Caffeine")) {
            Molecule molecule = new Molecule();
            molecule.setName(name);
            molecule.setSmiles("C");
            moleculeRepository.create(molecule);
        }
        predictionRepository.create(prediction("mol_1", ModelType.TOXICITY));
        predictionRepository.create(prediction("mol_1", ModelType.ADMET));
        predictionRepository.create(prediction("mol_3", ModelType.EFFICACY));

        DefaultBatchLoaderRegistry registry = new DefaultBatchLoaderRegistry();
        new DataLoaderConfig(
            registry,
            new UserRepository(mapper),
            moleculeRepository,
            projectRepository,
            new ClinicalTrialRepository(mapper),
            new ResearchPaperRepository(mapper),
            new SafetyEventRepository(mapper),
            predictionRepository,
            new ResearchInsightRepository(mapper),
            metrics);

        dataLoaders = new DataLoaderRegistry();
        registry.registerDataLoaders(dataLoaders, GraphQLContext.newContext().build());
        clearInvocations(moleculeRepository, predictionRepository, projectRepository);
    }

    @Test
    @DisplayName("Loads issued before dispatch become one repository call")
    void testLoadsAreBatched() {
        DataLoader<String, List<MLPrediction>> loader = dataLoaders.getDataLoader(Loaders.PREDICTIONS_BY_MOLECULE_ID);

        CompletableFuture<List<MLPrediction>> first = loader.load("mol_1");
        CompletableFuture<List<MLPrediction>> second = loader.load("mol_2");
        CompletableFuture<List<MLPrediction>> third = loader.load("mol_3");
        loader.dispatchAndJoin();

        verify(predictionRepository, times(1)).findAllByParentIds(eq(Relation.MOLECULE), any());
        assertThat(first.join()).hasSize(2);
        assertThat(second.join()).isEmpty();
        assertThat(third.join()).hasSize(1);
        assertThat(metrics.getBatchCount(Loaders.PREDICTIONS_BY_MOLECULE_ID)).isEqualTo(1.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDuplicateKeysFetchedOnce() {
        DataLoader<String, Molecule> loader = dataLoaders.getDataLoader(Loaders.MOLECULE_BY_ID);

        CompletableFuture<Molecule> a = loader.load("mol_2");
        CompletableFuture<Molecule> b = loader.load("mol_2");
        loader.load("mol_1");
        loader.dispatchAndJoin();

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(moleculeRepository, times(1)).findByIds(keys.capture());
        assertThat(keys.getValue()).containsExactlyInAnyOrder("mol_1", "mol_2");
        assertThat(a.join()).isSameAs(b.join());
        assertThat(a.join().getName()).isEqualTo("Ibuprofen");
    }

    @Test
    void testResultsAlignWithRequestedKeys() {
        DataLoader<String, Molecule> loader = dataLoaders.getDataLoader(Loaders.MOLECULE_BY_ID);

        CompletableFuture<List<Molecule>> result = loader.loadMany(Arrays.asList("mol_3", "mol_1", "mol_2"));
        loader.dispatchAndJoin();

        assertThat(result.join())
            .extracting(Molecule::getName)
            .containsExactly("Caffeine", "Aspirin", "Ibuprofen");
    }

    @Test
    void testMissingKeys_NullAndEmptyList() {
        DataLoader<String, Molecule> byId = dataLoaders.getDataLoader(Loaders.MOLECULE_BY_ID);
        DataLoader<String, List<Project>> byUser = dataLoaders.getDataLoader(Loaders.PROJECTS_BY_USER_ID);

        CompletableFuture<Molecule> missing = byId.load("mol_404");
        CompletableFuture<List<Project>> noProjects = byUser.load("user_404");
        dataLoaders.dispatchAll();

        assertThat(missing.join()).isNull();
        assertThat(noProjects.join()).isEmpty();
    }

    @Test
    void testValuesCachedForTheRequest() {
        DataLoader<String, Molecule> loader = dataLoaders.getDataLoader(Loaders.MOLECULE_BY_ID);

        loader.load("mol_1");
        loader.dispatchAndJoin();
        CompletableFuture<Molecule> again = loader.load("mol_1");
        loader.dispatchAndJoin();

        verify(moleculeRepository, times(1)).findByIds(anyList());
        assertThat(again.join().getName()).isEqualTo("Aspirin");
    }

    @Test
    @DisplayName("A failing batch fails its own keys and leaves other loaders untouched")
    void testBatchFailureIsIsolated() {
        doThrow(new IllegalStateException("store offline"))
            .when(predictionRepository).findAllByParentIds(eq(Relation.MOLECULE), any(Collection.class));

        DataLoader<String, List<MLPrediction>> predictions = dataLoaders.getDataLoader(Loaders.PREDICTIONS_BY_MOLECULE_ID);
        DataLoader<String, Molecule> molecules = dataLoaders.getDataLoader(Loaders.MOLECULE_BY_ID);

        CompletableFuture<List<MLPrediction>> failed1 = predictions.load("mol_1");
        CompletableFuture<List<MLPrediction>> failed2 = predictions.load("mol_2");
        CompletableFuture<Molecule> unaffected = molecules.load("mol_1");
        dataLoaders.dispatchAll();

        assertThat(unaffected.join().getName()).isEqualTo("Aspirin");
        for (CompletableFuture<List<MLPrediction>> future : Arrays.asList(failed1, failed2)) {
            BatchFetchException error = findBatchFailure(catchThrowable(future::join));
            assertThat(error).isNotNull();
            assertThat(error.getLoaderName()).isEqualTo(Loaders.PREDICTIONS_BY_MOLECULE_ID);
            assertThat(error.getBatchSize()).isEqualTo(2);
            assertThat(error.getMessage()).contains("store offline");
        }
        assertThat(metrics.getFailureCount(Loaders.PREDICTIONS_BY_MOLECULE_ID)).isEqualTo(1.0);
        assertThat(metrics.getFailureCount(Loaders.MOLECULE_BY_ID)).isZero();
    }

    private static BatchFetchException findBatchFailure(Throwable thrown) {
        Throwable current = thrown;
        while (current != null) {
            if (current instanceof BatchFetchException) {
                return (BatchFetchException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static MLPrediction prediction(String moleculeId, ModelType modelType) {
        MLPrediction prediction = new MLPrediction();
        prediction.setMoleculeId(moleculeId);
        prediction.setModelType(modelType);
        return prediction;
    }
}
