package com.pharmos.graphql;

import com.pharmos.domain.Molecule;
import com.pharmos.domain.Project;
import com.pharmos.domain.Role;
import com.pharmos.events.ActivityFeed;
import com.pharmos.events.Topic;
import com.pharmos.graphql.input.MoleculeInput;
import com.pharmos.prediction.PredictionProvider;
import com.pharmos.query.EntityFilter;
import com.pharmos.query.Paginator;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.storage.MoleculeRepository;
import com.pharmos.storage.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MoleculeController guards, validation and event publishing.
 */
@ExtendWith(MockitoExtension.class)
class MoleculeControllerTest {

    private static final String ASPIRIN = "CC(=O)OC1=CC=CC=C1C(=O)O";

    @Mock
    private MoleculeRepository moleculeRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private PredictionProvider predictionProvider;

    @Mock
    private ActivityFeed activityFeed;

    private MoleculeController controller;
    private Identity researcher;
    private Identity lead;

    @BeforeEach
    void setUp() {
        controller = new MoleculeController(moleculeRepository, projectRepository, predictionProvider,
            new Paginator(), new AccessGuard(), activityFeed);
        researcher = new Identity("user_researcher", "researcher@pharmos.com", Role.RESEARCHER, Collections.emptyList());
        lead = new Identity("user_lead", "lead@pharmos.com", Role.LEAD_SCIENTIST, Collections.emptyList());
    }

    @Test
    void testCreateMolecule_Unauthenticated() {
        // Act & Assert
        assertThatThrownBy(() -> controller.createMolecule(new MoleculeInput("Aspirin", ASPIRIN), null))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.UNAUTHENTICATED);

        verifyNoInteractions(moleculeRepository, activityFeed);
    }

    @Test
    void testCreateMolecule_InvalidSmiles_NothingWritten() {
        // Arrange
        MoleculeInput input = new MoleculeInput("Broken", "CC(=O");

        // Act & Assert
        assertThatThrownBy(() -> controller.createMolecule(input, researcher))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.INVALID_INPUT);

        verify(moleculeRepository, never()).create(any());
        verifyNoInteractions(activityFeed);
    }

    @Test
    @DisplayName("createMolecule writes first and publishes afterwards")
    void testCreateMolecule_PublishesAfterWrite() {
        // Arrange
        MoleculeInput input = new MoleculeInput("Aspirin", ASPIRIN);
        input.setProjectIds(Arrays.asList("proj_1"));
        when(moleculeRepository.create(any(Molecule.class))).thenAnswer(invocation -> {
            Molecule molecule = invocation.getArgument(0);
            molecule.setId("mol_1");
            return molecule;
        });

        // Act
        Molecule created = controller.createMolecule(input, researcher);

        // Assert
        assertThat(created.getId()).isEqualTo("mol_1");
        assertThat(created.getName()).isEqualTo("Aspirin");
        InOrder inOrder = inOrder(moleculeRepository, activityFeed);
        inOrder.verify(moleculeRepository).create(any(Molecule.class));
        inOrder.verify(activityFeed).publish(eq(Topic.MOLECULE_CREATED), eq(created), eq("mol_1"),
            eq("proj_1"), eq(researcher), anyString());
    }

    @Test
    void testCreateMoleculesBatch_OneInvalidInputRejectsAll() {
        // Arrange
        List<MoleculeInput> inputs = Arrays.asList(
            new MoleculeInput("Aspirin", ASPIRIN),
            new MoleculeInput("", "CCO"));

        // Act & Assert
        assertThatThrownBy(() -> controller.createMoleculesBatch(inputs, researcher))
            .isInstanceOf(GraphQLException.class)
            .hasMessage("inputs[1]: name is required");

        verify(moleculeRepository, never()).create(any());
        verifyNoInteractions(activityFeed);
    }

    @Test
    void testCreateMoleculesBatch_PublishesPerMolecule() {
        when(moleculeRepository.create(any(Molecule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        List<Molecule> created = controller.createMoleculesBatch(Arrays.asList(
            new MoleculeInput("Aspirin", ASPIRIN),
            new MoleculeInput("Ethanol", "CCO")), researcher);

        assertThat(created).extracting(Molecule::getName).containsExactly("Aspirin", "Ethanol");
        verify(activityFeed, times(2)).publish(eq(Topic.MOLECULE_CREATED), any(), any(), any(), eq(researcher), anyString());
    }

    @Test
    void testUpdateMolecule_UnknownId_ReturnsNullWithoutEvent() {
        // Arrange
        MoleculeInput patch = new MoleculeInput();
        patch.setLogP(1.2);
        when(moleculeRepository.update(eq("mol_404"), any())).thenReturn(null);

        // Act
        Molecule result = controller.updateMolecule("mol_404", patch, researcher);

        // Assert
        assertThat(result).isNull();
        verifyNoInteractions(activityFeed);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUpdateMolecule_AppliesPatch() {
        // Arrange
        Molecule stored = new MoleculeInput("Aspirin", ASPIRIN).toEntity();
        stored.setId("mol_1");
        when(moleculeRepository.update(eq("mol_1"), any())).thenAnswer(invocation -> {
            ((Consumer<Molecule>) invocation.getArgument(1)).accept(stored);
            return stored;
        });
        MoleculeInput patch = new MoleculeInput();
        patch.setLogP(1.2);

        // Act
        Molecule updated = controller.updateMolecule("mol_1", patch, researcher);

        // Assert
        assertThat(updated.getLogP()).isEqualTo(1.2);
        assertThat(updated.getName()).isEqualTo("Aspirin");
        verify(activityFeed).publish(eq(Topic.MOLECULE_UPDATED), eq(stored), eq("mol_1"), isNull(),
            eq(researcher), anyString());
    }

    @Test
    void testDeleteMolecule_RequiresLeadScientist() {
        assertThatThrownBy(() -> controller.deleteMolecule("mol_1", researcher))
            .isInstanceOf(GraphQLException.class)
            .extracting("errorCode")
            .isEqualTo(GraphQLException.FORBIDDEN);

        verify(moleculeRepository, never()).delete(anyString());
    }

    @Test
    void testDeleteMolecule_PublishesId() {
        when(moleculeRepository.delete("mol_1")).thenReturn(true);

        assertThat(controller.deleteMolecule("mol_1", lead)).isTrue();

        verify(activityFeed).publish(eq(Topic.MOLECULE_DELETED), eq("mol_1"), eq("mol_1"), isNull(),
            eq(lead), anyString());
    }

    @Test
    void testDeleteMolecule_UnknownId() {
        when(moleculeRepository.delete("mol_404")).thenReturn(false);

        assertThat(controller.deleteMolecule("mol_404", lead)).isFalse();
        verifyNoInteractions(activityFeed);
    }

    @Test
    void testLinkMoleculeToProject_UnknownProject() {
        when(projectRepository.findById("proj_404")).thenReturn(null);

        assertThatThrownBy(() -> controller.linkMoleculeToProject("mol_1", "proj_404", researcher))
            .isInstanceOf(GraphQLException.class)
            .hasMessageContaining("proj_404");

        verify(moleculeRepository, never()).update(anyString(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLinkMoleculeToProject_IsIdempotent() {
        Project project = new Project();
        project.setId("proj_1");
        project.setName("Kinase");
        when(projectRepository.findById("proj_1")).thenReturn(project);
        Molecule stored = new MoleculeInput("Aspirin", ASPIRIN).toEntity();
        stored.setId("mol_1");
        stored.getProjectIds().add("proj_1");
        when(moleculeRepository.update(eq("mol_1"), any())).thenAnswer(invocation -> {
            ((Consumer<Molecule>) invocation.getArgument(1)).accept(stored);
            return stored;
        });

        Molecule linked = controller.linkMoleculeToProject("mol_1", "proj_1", researcher);

        assertThat(linked.getProjectIds()).containsExactly("proj_1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLinkAndUnlink_PaddedProjectIdStoredTrimmed() {
        Project project = new Project();
        project.setId("proj_1");
        project.setName("Kinase");
        when(projectRepository.findById("proj_1")).thenReturn(project);
        Molecule stored = new MoleculeInput("Aspirin", ASPIRIN).toEntity();
        stored.setId("mol_1");
        when(moleculeRepository.update(eq("mol_1"), any())).thenAnswer(invocation -> {
            ((Consumer<Molecule>) invocation.getArgument(1)).accept(stored);
            return stored;
        });

        controller.linkMoleculeToProject("mol_1", " proj_1 ", researcher);
        Molecule relinked = controller.linkMoleculeToProject("mol_1", "proj_1", researcher);

        assertThat(relinked.getProjectIds()).containsExactly("proj_1");

        Molecule unlinked = controller.unlinkMoleculeFromProject("mol_1", " proj_1 ", researcher);

        assertThat(unlinked.getProjectIds()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSimilarMolecules_OrderedByScoreAndExcludesQuery() {
        // Arrange
        List<Molecule> stored = Arrays.asList(
            molecule("mol_1", "Aspirin", ASPIRIN),
            molecule("mol_2", "Close", "CCO"),
            molecule("mol_3", "Closer", "CCOC"),
            molecule("mol_4", "Far", "NNN"));
        when(moleculeRepository.findAll(any())).thenAnswer(invocation -> {
            EntityFilter<Molecule> filter = invocation.getArgument(0);
            return stored.stream().filter(filter::matches).collect(Collectors.toList());
        });
        when(predictionProvider.similarity(eq(ASPIRIN), anyString())).thenAnswer(invocation -> {
            String candidate = invocation.getArgument(1);
            return candidate.equals("CCOC") ? 0.9 : candidate.equals("CCO") ? 0.75 : 0.1;
        });

        // Act
        List<Molecule> similar = controller.similarMolecules(ASPIRIN, null, null, researcher);

        // Assert
        assertThat(similar).extracting(Molecule::getId).containsExactly("mol_3", "mol_2");
    }

    @Test
    void testSimilarMolecules_ThresholdOutOfRange() {
        assertThatThrownBy(() -> controller.similarMolecules(ASPIRIN, 1.5, null, researcher))
            .isInstanceOf(GraphQLException.class)
            .hasMessageContaining("threshold");
    }

    private static Molecule molecule(String id, String name, String smiles) {
        Molecule molecule = new Molecule();
        molecule.setId(id);
        molecule.setName(name);
        molecule.setSmiles(smiles);
        return molecule;
    }
}
