package com.driftsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DivergenceMath}.
 */
class DivergenceMathTest {

    @Test
    @DisplayName("PSI of identical samples is exactly zero")
    void psiOfIdenticalSamplesIsZero() {
        List<Double> sample = range(0, 10, 0);
        assertThat(DivergenceMath.psi(sample, new ArrayList<>(sample))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("PSI matches a hand-computed two-bin histogram")
    void psiMatchesHandComputedValue() {
        // edges [0, 0.5, 1]; expected counts [2, 2], actual counts [1, 3]
        double psi = DivergenceMath.psi(List.of(0.0, 0.0, 1.0, 1.0), List.of(0.0, 1.0, 1.0, 1.0), 2);
        assertThat(psi).isCloseTo(0.274349, within(1e-6));
    }

    @Test
    @DisplayName("PSI grows with the size of the shift")
    void psiGrowsWithShift() {
        List<Double> baseline = range(0, 10, 0);
        double small = DivergenceMath.psi(baseline, range(0, 10, 1));
        double large = DivergenceMath.psi(baseline, range(0, 10, 3));
        double disjoint = DivergenceMath.psi(baseline, range(0, 10, 100));

        assertThat(small).isCloseTo(0.75938, within(1e-4));
        assertThat(large).isGreaterThan(small);
        assertThat(disjoint).isGreaterThan(large);
    }

    @Test
    @DisplayName("PSI is symmetric in its arguments")
    void psiIsSymmetric() {
        List<Double> a = List.of(0.1, 0.2, 0.2, 0.3, 0.4, 0.5, 0.5, 0.6, 0.8, 0.9);
        List<Double> b = List.of(0.3, 0.5, 0.6, 0.6, 0.7, 0.7, 0.8, 0.9, 0.9, 1.0, 1.0);
        assertThat(DivergenceMath.psi(a, b)).isCloseTo(DivergenceMath.psi(b, a), within(1e-12));
    }

    @Test
    @DisplayName("KL divergence is asymmetric")
    void klIsAsymmetric() {
        List<Double> p = List.of(0.0, 0.0, 0.0, 0.0, 10.0);
        List<Double> q = List.of(0.0, 5.0, 5.0, 5.0, 10.0);

        double pq = DivergenceMath.klDivergence(p, q);
        double qp = DivergenceMath.klDivergence(q, p);

        assertThat(pq).isCloseTo(1.10490, within(1e-4));
        assertThat(qp).isCloseTo(4.51920, within(1e-4));
    }

    @Test
    @DisplayName("Repeated calls return bit-identical results")
    void resultsAreDeterministic() {
        List<Double> a = range(0, 50, 0);
        List<Double> b = range(10, 70, 0);
        assertThat(DivergenceMath.psi(a, b)).isEqualTo(DivergenceMath.psi(a, b));
        assertThat(DivergenceMath.klDivergence(a, b)).isEqualTo(DivergenceMath.klDivergence(a, b));
    }

    @Test
    @DisplayName("An empty sample on either side yields zero")
    void emptySampleYieldsZero() {
        List<Double> sample = List.of(1.0, 2.0, 3.0);
        assertThat(DivergenceMath.psi(List.of(), sample)).isEqualTo(0.0);
        assertThat(DivergenceMath.psi(sample, List.of())).isEqualTo(0.0);
        assertThat(DivergenceMath.klDivergence(List.of(), sample)).isEqualTo(0.0);
        assertThat(DivergenceMath.klDivergence(sample, List.of())).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Constant samples land in the last bin and compare equal")
    void constantSamplesCompareEqual() {
        List<Double> constant = List.of(5.0, 5.0, 5.0);
        assertThat(DivergenceMath.psi(constant, List.of(5.0, 5.0))).isEqualTo(0.0);

        double[] edges = DivergenceMath.binEdges(constant, constant, 10);
        assertThat(DivergenceMath.binIndex(5.0, edges, 10)).isEqualTo(9);
    }

    @Test
    @DisplayName("Bins are right-open except the last, which includes the maximum")
    void binBoundaries() {
        double[] edges = DivergenceMath.binEdges(List.of(0.0), List.of(10.0), 10);
        assertThat(DivergenceMath.binIndex(0.0, edges, 10)).isZero();
        assertThat(DivergenceMath.binIndex(1.0, edges, 10)).isEqualTo(1);
        assertThat(DivergenceMath.binIndex(9.999, edges, 10)).isEqualTo(9);
        assertThat(DivergenceMath.binIndex(10.0, edges, 10)).isEqualTo(9);
    }

    @Test
    @DisplayName("Smoothed proportions are strictly positive and sum to one")
    void proportionsAreSmoothed() {
        double[] edges = DivergenceMath.binEdges(List.of(0.0, 1.0), List.of(), 4);
        double[] props = DivergenceMath.proportions(List.of(0.0, 1.0), edges, 4);

        assertThat(Arrays.stream(props).min().orElseThrow()).isPositive();
        assertThat(Arrays.stream(props).sum()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Non-finite values are rejected")
    void rejectsNonFiniteValues() {
        List<Double> withNaN = List.of(1.0, Double.NaN);
        List<Double> withInf = List.of(1.0, Double.POSITIVE_INFINITY);

        assertThatThrownBy(() -> DivergenceMath.psi(List.of(1.0, 2.0), withNaN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-finite");
        assertThatThrownBy(() -> DivergenceMath.klDivergence(withInf, List.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A bin count below one is rejected")
    void rejectsInvalidBinCount() {
        assertThatThrownBy(() -> DivergenceMath.psi(List.of(1.0), List.of(2.0), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bins");
    }

    // ---- Helpers ----

    private static List<Double> range(int from, int to, double offset) {
        List<Double> values = new ArrayList<>();
        for (int i = from; i < to; i++) {
            values.add(i + offset);
        }
        return values;
    }
}
