package com.pharmos.graphql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.MLPrediction;
import com.pharmos.domain.ModelType;
import com.pharmos.domain.Molecule;
import com.pharmos.domain.Role;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.prediction.DescriptorPredictionProvider;
import com.pharmos.query.Paginated;
import com.pharmos.query.Paginator;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.MoleculeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MLPredictionControllerTest {

    @Mock
    private ActivityFeed activityFeed;

    private MLPredictionRepository predictionRepository;
    private MLPredictionController controller;
    private Identity researcher;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        predictionRepository = new MLPredictionRepository(mapper);
        MoleculeRepository moleculeRepository = new MoleculeRepository(mapper);
        Molecule aspirin = new Molecule();
        aspirin.setName("Aspirin");
        aspirin.setSmiles("CC(=O)OC1=CC=CC=C1C(=O)O");
        aspirin.setProjectIds(Arrays.asList("proj_1"));
        moleculeRepository.create(aspirin);

        controller = new MLPredictionController(predictionRepository, moleculeRepository,
            new DescriptorPredictionProvider(), new Paginator(), new AccessGuard(), activityFeed);
        researcher = new Identity("user_researcher", "researcher@pharmos.com", Role.RESEARCHER, Collections.emptyList());
    }

    @Test
    void testRequestPrediction_StoresAndPublishes() {
        MLPrediction prediction = controller.requestPrediction("mol_1", ModelType.TOXICITY, researcher);

        assertThat(prediction.getId()).isEqualTo("pred_1");
        assertThat(prediction.getMoleculeId()).isEqualTo("mol_1");
        assertThat(prediction.getModelVersion()).isEqualTo(DescriptorPredictionProvider.MODEL_VERSION);
        assertThat(prediction.getPredictions()).containsKey("toxicity_score");
        assertThat(prediction.getTimestamp()).isNotNull();
        verify(activityFeed).publish(eq(Topic.ML_PREDICTION_COMPLETED), eq(prediction), eq("pred_1"),
            eq("proj_1"), eq(researcher), anyString());
    }

    @Test
    void testRequestPrediction_UnknownMolecule() {
        assertThatThrownBy(() -> controller.requestPrediction("mol_404", ModelType.ADMET, researcher))
            .isInstanceOf(GraphQLException.class)
            .hasMessage("Unknown molecule: mol_404");

        assertThat(predictionRepository.count()).isZero();
    }

    @Test
    void testRequestPrediction_ModelTypeRequired() {
        assertThatThrownBy(() -> controller.requestPrediction("mol_1", null, researcher))
            .isInstanceOf(GraphQLException.class)
            .hasMessage("modelType is required");
    }

    @Test
    void testMlPredictions_FilteredByModelType() {
        controller.requestPrediction("mol_1", ModelType.TOXICITY, researcher);
        controller.requestPrediction("mol_1", ModelType.ADMET, researcher);
        controller.requestPrediction("mol_1", ModelType.TOXICITY, researcher);

        Paginated<MLPrediction> page = controller.mlPredictions("mol_1", ModelType.TOXICITY, null, researcher);

        assertThat(page.getData()).hasSize(2);
        assertThat(page.getData()).allMatch(p -> p.getModelType() == ModelType.TOXICITY);
        assertThat(page.getPagination().isHasNextPage()).isFalse();
    }
}
