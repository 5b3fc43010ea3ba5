package com.pharmos.graphql;

import com.pharmos.domain.Role;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.MLPredictionRepository;
import com.pharmos.storage.Relation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.graphql.ExecutionGraphQlService;
import org.springframework.graphql.test.tester.ExecutionGraphQlServiceTester;
import org.springframework.graphql.test.tester.GraphQlTester;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests through the GraphQL engine with the seeded data set.
 *
 * The identity is placed in the GraphQL context directly, the way the
 * identity interceptor does for HTTP and WebSocket requests.
 */
@SpringBootTest
class GraphQLApiIntegrationTest {

    @Autowired
    private ExecutionGraphQlService graphQlService;

    @SpyBean
    private MLPredictionRepository predictionRepository;

    private GraphQlTester admin;
    private GraphQlTester anonymous;

    @BeforeEach
    void setUp() {
        admin = testerFor(new Identity("user_admin", "admin@pharmos.com", Role.ADMIN, Collections.emptyList()));
        anonymous = ExecutionGraphQlServiceTester.create(graphQlService);
        clearInvocations(predictionRepository);
    }

    @Test
    void testPredictionsForSeveralMoleculesInOneBatch() {
        admin.document("{ molecules(pagination: {page: 1, limit: 3, sortBy: \"name\", sortOrder: ASC}) "
                + "{ data { id predictions { id modelType } } pagination { total hasNextPage hasPreviousPage } } }")
            .execute()
            .path("molecules.data").entityList(Object.class).hasSize(3)
            .path("molecules.pagination.hasPreviousPage").entity(Boolean.class).isEqualTo(false);

        verify(predictionRepository, times(1)).findAllByParentIds(eq(Relation.MOLECULE), anyCollection());
    }

    @Test
    void testCreateThenFetchMolecule() {
        String id = admin.document("mutation { createMolecule(input: "
                + "{name: \"Paracetamol\", smiles: \"CC(=O)NC1=CC=C(O)C=C1\", molecularWeight: 151.16}) { id name } }")
            .execute()
            .path("createMolecule.name").entity(String.class).isEqualTo("Paracetamol")
            .path("createMolecule.id").entity(String.class).get();

        admin.document("query($id: ID!) { molecule(id: $id) { name smiles molecularWeight predictions { id } } }")
            .variable("id", id)
            .execute()
            .path("molecule.smiles").entity(String.class).isEqualTo("CC(=O)NC1=CC=C(O)C=C1")
            .path("molecule.molecularWeight").entity(Double.class).isEqualTo(151.16)
            .path("molecule.predictions").entityList(Object.class).hasSize(0);
    }

    @Test
    void testUnknownMoleculeIsNull() {
        admin.document("{ molecule(id: \"mol_does_not_exist\") { id } }")
            .execute()
            .path("molecule").valueIsNull();
    }

    @Test
    void testWithoutIdentityReportsUnauthenticated() {
        anonymous.document("{ molecules { data { id } } }")
            .execute()
            .errors()
            .satisfy(errors -> {
                assertThat(errors).hasSize(1);
                assertThat(errors.get(0).getExtensions()).containsEntry("errorCode", "UNAUTHENTICATED");
            });
    }

    @Test
    void testInvalidInputReportedWithoutWrite() {
        admin.document("mutation { createMolecule(input: {name: \"Broken\", smiles: \"CC(=O\"}) { id } }")
            .execute()
            .errors()
            .satisfy(errors -> assertThat(errors)
                .anySatisfy(error -> assertThat(error.getExtensions()).containsEntry("errorCode", "INVALID_INPUT")))
            .path("createMolecule").valueIsNull();
    }

    @Test
    void testMoleculeCreatedSubscription() {
        Flux<String> names = admin.document("subscription { moleculeCreated { name } }")
            .executeSubscription()
            .toFlux("moleculeCreated.name", String.class);

        StepVerifier.create(names)
            .then(() -> admin.document("mutation { createMolecule(input: {name: \"Theobromine\", "
                    + "smiles: \"CN1C=NC2=C1C(=O)NC(=O)N2C\"}) { id } }")
                .execute()
                .path("createMolecule.id").hasValue())
            .expectNext("Theobromine")
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testAnalyticsOverSeedData() {
        List<Object> buckets = admin.document("{ safetyAnalytics { totalEvents bySeverity { key count } } }")
            .execute()
            .path("safetyAnalytics.bySeverity").entityList(Object.class).get();

        assertThat(buckets).isNotEmpty();
    }

    private GraphQlTester testerFor(Identity identity) {
        return ExecutionGraphQlServiceTester.builder(graphQlService)
            .configureExecutionInput((input, builder) ->
                builder.graphQLContext(context -> context.of(IdentityInterceptor.IDENTITY_KEY, identity)).build())
            .build();
    }
}
