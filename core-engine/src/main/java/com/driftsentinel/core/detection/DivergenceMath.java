package com.driftsentinel.core.detection;

import java.util.List;
import java.util.Objects;

/**
 * Histogram-based divergence measures between two samples.
 *
 * <h3>Binning</h3>
 * <p>
 * Both samples share {@code bins} equal-width bins spanning
 * {@code [min, max]} of their union. Bins are right-open
 * {@code [e_i, e_{i+1})} except the last one, which is closed, so every
 * value belongs to exactly one bin. When all values are equal the range is
 * empty and every value falls in the last bin.
 * </p>
 *
 * <h3>Smoothing</h3>
 * <p>
 * Counts become proportions with additive smoothing
 * {@code p_i = (count_i + ε) / (n + ε·bins)}, {@code ε =} {@value #EPSILON},
 * so every proportion is strictly positive.
 * </p>
 *
 * <p>
 * All methods are pure and deterministic. An empty sample on either side
 * yields {@code 0.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DivergenceMath {

    /** Additive smoothing constant. */
    public static final double EPSILON = 0.001;

    /** Default number of histogram bins. */
    public static final int DEFAULT_BINS = 10;

    private DivergenceMath() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Population Stability Index
    // ---------------------------------------------------------------

    public static double psi(List<Double> expected, List<Double> actual) {
        return psi(expected, actual, DEFAULT_BINS);
    }

    /**
     * Population Stability Index of {@code actual} against {@code expected}:
     * {@code Σ (a_i − e_i) · ln(a_i / e_i)}.
     *
     * @param expected baseline sample
     * @param actual   current sample
     * @param bins     number of bins; must be &gt;= 1
     * @return PSI, {@code 0.0} when either sample is empty
     * @throws IllegalArgumentException if a value is not finite or
     *                                  {@code bins < 1}
     */
    public static double psi(List<Double> expected, List<Double> actual, int bins) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
        requireBins(bins);
        if (expected.isEmpty() || actual.isEmpty()) {
            return 0.0;
        }

        double[] edges = binEdges(expected, actual, bins);
        double[] e = proportions(expected, edges, bins);
        double[] a = proportions(actual, edges, bins);

        double psi = 0.0;
        for (int i = 0; i < bins; i++) {
            if (e[i] > 0 && a[i] > 0) {
                psi += (a[i] - e[i]) * Math.log(a[i] / e[i]);
            }
        }
        return psi;
    }

    // ---------------------------------------------------------------
    // Kullback-Leibler divergence
    // ---------------------------------------------------------------

    public static double klDivergence(List<Double> p, List<Double> q) {
        return klDivergence(p, q, DEFAULT_BINS);
    }

    /**
     * Directed KL divergence {@code D(P || Q) = Σ p_i · ln(p_i / q_i)}.
     *
     * <p>
     * Asymmetric: {@code p} is the distribution being measured and
     * {@code q} the reference.
     * </p>
     *
     * @param p    measured sample
     * @param q    reference sample
     * @param bins number of bins; must be &gt;= 1
     * @return divergence, {@code 0.0} when either sample is empty
     * @throws IllegalArgumentException if a value is not finite or
     *                                  {@code bins < 1}
     */
    public static double klDivergence(List<Double> p, List<Double> q, int bins) {
        Objects.requireNonNull(p, "p must not be null");
        Objects.requireNonNull(q, "q must not be null");
        requireBins(bins);
        if (p.isEmpty() || q.isEmpty()) {
            return 0.0;
        }

        double[] edges = binEdges(p, q, bins);
        double[] pp = proportions(p, edges, bins);
        double[] qq = proportions(q, edges, bins);

        double kl = 0.0;
        for (int i = 0; i < bins; i++) {
            if (pp[i] > 0 && qq[i] > 0) {
                kl += pp[i] * Math.log(pp[i] / qq[i]);
            }
        }
        return kl;
    }

    // ---------------------------------------------------------------
    // Binning helpers
    // ---------------------------------------------------------------

    static double[] binEdges(List<Double> a, List<Double> b, int bins) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (List<Double> sample : List.of(a, b)) {
            for (Double v : sample) {
                requireFinite(v);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        double width = (max - min) / bins;
        double[] edges = new double[bins + 1];
        for (int i = 0; i <= bins; i++) {
            edges[i] = min + i * width;
        }
        return edges;
    }

    /**
     * @return index of the bin holding {@code value}; values are assumed to
     *         lie within {@code [edges[0], edges[bins]]}
     */
    static int binIndex(double value, double[] edges, int bins) {
        for (int i = 0; i < bins - 1; i++) {
            if (value < edges[i + 1]) {
                return i;
            }
        }
        return bins - 1;
    }

    static double[] proportions(List<Double> values, double[] edges, int bins) {
        int[] counts = new int[bins];
        for (Double v : values) {
            counts[binIndex(v, edges, bins)]++;
        }
        double denominator = values.size() + EPSILON * bins;
        double[] props = new double[bins];
        for (int i = 0; i < bins; i++) {
            props[i] = (counts[i] + EPSILON) / denominator;
        }
        return props;
    }

    private static void requireFinite(Double v) {
        if (v == null || !Double.isFinite(v)) {
            throw new IllegalArgumentException("Sample contains a non-finite value: " + v);
        }
    }

    private static void requireBins(int bins) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1, got: " + bins);
        }
    }
}
