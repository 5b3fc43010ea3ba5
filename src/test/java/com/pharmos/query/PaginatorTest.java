package com.pharmos.query;

import com.pharmos.domain.Molecule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for Paginator: sorting, slicing and page metadata.
 */
class PaginatorTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private Paginator paginator;
    private List<Molecule> molecules;

    @BeforeEach
    void setUp() {
        paginator = new Paginator();
        molecules = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            molecules.add(molecule(String.format("mol_%02d", i), "Molecule " + i, 100.0 + i, BASE.plusSeconds(i)));
        }
    }

    @Test
    @DisplayName("First page of 25 items with limit 10 has next but no previous page")
    void testFirstPage() {
        Paginated<Molecule> page = paginator.paginate(molecules, PaginationInput.of(1, 10), SortKeys.MOLECULE);

        assertThat(page.getData()).hasSize(10);
        assertThat(page.getPagination().getTotal()).isEqualTo(25);
        assertThat(page.getPagination().getTotalPages()).isEqualTo(3);
        assertThat(page.getPagination().isHasNextPage()).isTrue();
        assertThat(page.getPagination().isHasPreviousPage()).isFalse();
    }

    @Test
    @DisplayName("Last page of 25 items with limit 10 holds the remaining 5")
    void testLastPage() {
        Paginated<Molecule> page = paginator.paginate(molecules, PaginationInput.of(3, 10), SortKeys.MOLECULE);

        assertThat(page.getData()).hasSize(5);
        assertThat(page.getPagination().isHasNextPage()).isFalse();
        assertThat(page.getPagination().isHasPreviousPage()).isTrue();
    }

    @Test
    void testPageBeyondEnd_ReturnsEmptyData() {
        Paginated<Molecule> page = paginator.paginate(molecules, PaginationInput.of(9, 10), SortKeys.MOLECULE);

        assertThat(page.getData()).isEmpty();
        assertThat(page.getPagination().getTotal()).isEqualTo(25);
        assertThat(page.getPagination().isHasNextPage()).isFalse();
        assertThat(page.getPagination().isHasPreviousPage()).isTrue();
    }

    @Test
    void testVeryLargePage_ReturnsEmptyData() {
        PaginationInput input = new PaginationInput(Integer.MAX_VALUE - 1, 20, "name", SortOrder.ASC);

        Paginated<Molecule> page = paginator.paginate(molecules, input, SortKeys.MOLECULE);

        assertThat(page.getData()).isEmpty();
        assertThat(page.getPagination().getPage()).isEqualTo(Integer.MAX_VALUE - 1);
        assertThat(page.getPagination().getTotal()).isEqualTo(25);
        assertThat(page.getPagination().isHasNextPage()).isFalse();
    }

    @Test
    void testDefaults_NewestFirstWithDefaultLimit() {
        Paginated<Molecule> page = paginator.paginate(molecules, null, SortKeys.MOLECULE);

        assertThat(page.getData()).hasSize(Paginator.DEFAULT_LIMIT);
        assertThat(page.getPagination().getPage()).isEqualTo(1);
        assertThat(page.getData().get(0).getId()).isEqualTo("mol_25");
    }

    @Test
    void testNormalization_ClampsPageAndLimit() {
        PaginationInput input = new PaginationInput(0, 1000, null, null);

        Paginated<Molecule> page = paginator.paginate(molecules, input, SortKeys.MOLECULE);

        assertThat(page.getPagination().getPage()).isEqualTo(1);
        assertThat(page.getPagination().getLimit()).isEqualTo(Paginator.MAX_LIMIT);
        assertThat(page.getData()).hasSize(25);
    }

    @Test
    void testZeroLimit_ClampedToOne() {
        Paginated<Molecule> page = paginator.paginate(molecules, PaginationInput.of(1, 0), SortKeys.MOLECULE);

        assertThat(page.getData()).hasSize(1);
        assertThat(page.getPagination().getLimit()).isEqualTo(1);
    }

    @Test
    void testSortAscendingByMolecularWeight() {
        PaginationInput input = new PaginationInput(1, 3, "molecularWeight", SortOrder.ASC);

        Paginated<Molecule> page = paginator.paginate(molecules, input, SortKeys.MOLECULE);

        assertThat(page.getData()).extracting(Molecule::getId).containsExactly("mol_01", "mol_02", "mol_03");
    }

    @Test
    @DisplayName("Equal sort keys are ordered by id so pages neither overlap nor skip")
    void testTieBreakById() {
        List<Molecule> ties = new ArrayList<>();
        for (String id : List.of("mol_c", "mol_a", "mol_e", "mol_b", "mol_d")) {
            ties.add(molecule(id, "Same", 1.0, BASE));
        }
        PaginationInput first = new PaginationInput(1, 2, "name", SortOrder.DESC);
        PaginationInput second = new PaginationInput(2, 2, "name", SortOrder.DESC);
        PaginationInput third = new PaginationInput(3, 2, "name", SortOrder.DESC);

        List<String> seen = new ArrayList<>();
        seen.addAll(ids(paginator.paginate(ties, first, SortKeys.MOLECULE)));
        seen.addAll(ids(paginator.paginate(ties, second, SortKeys.MOLECULE)));
        seen.addAll(ids(paginator.paginate(ties, third, SortKeys.MOLECULE)));

        assertThat(seen).containsExactly("mol_a", "mol_b", "mol_c", "mol_d", "mol_e");
    }

    @Test
    void testNullSortValuesGoLast() {
        Molecule unweighed = molecule("mol_x", "Unweighed", null, BASE);
        List<Molecule> items = new ArrayList<>(molecules.subList(0, 3));
        items.add(0, unweighed);

        Paginated<Molecule> page = paginator.paginate(items,
            new PaginationInput(1, 10, "molecularWeight", SortOrder.ASC), SortKeys.MOLECULE);

        assertThat(page.getData().get(page.getData().size() - 1).getId()).isEqualTo("mol_x");
    }

    @Test
    void testUnknownSortField_Throws() {
        PaginationInput input = new PaginationInput(1, 10, "colour", SortOrder.ASC);

        assertThatThrownBy(() -> paginator.paginate(molecules, input, SortKeys.MOLECULE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("colour");
    }

    @Test
    void testTotalReflectsFilteredSet() {
        MoleculeFilter filter = new MoleculeFilter();
        filter.setMaxMolecularWeight(110.0);
        List<Molecule> filtered = molecules.stream().filter(filter::matches).collect(Collectors.toList());

        Paginated<Molecule> page = paginator.paginate(filtered, PaginationInput.of(1, 4), SortKeys.MOLECULE);

        assertThat(page.getPagination().getTotal()).isEqualTo(10);
        assertThat(page.getPagination().getTotalPages()).isEqualTo(3);
    }

    @Test
    void testInvalidConfiguration_Rejected() {
        assertThatThrownBy(() -> new Paginator(50, 10))
            .isInstanceOf(IllegalStateException.class);
    }

    private static List<String> ids(Paginated<Molecule> page) {
        return page.getData().stream().map(Molecule::getId).collect(Collectors.toList());
    }

    private static Molecule molecule(String id, String name, Double weight, Instant createdAt) {
        Molecule molecule = new Molecule();
        molecule.setId(id);
        molecule.setName(name);
        molecule.setSmiles("C");
        molecule.setMolecularWeight(weight);
        molecule.setCreatedAt(createdAt);
        molecule.setUpdatedAt(createdAt);
        return molecule;
    }
}
