package io.newsclusters.digest.api.service.similarity;

import java.util.List;
import java.util.Map;

/**
 * Square similarity matrix over headline indices.
 */
public final class SimilarityMatrix {

    private static final SimilarityMatrix EMPTY = new SimilarityMatrix(new double[0][0]);

    private final double[][] values;

    private SimilarityMatrix(double[][] values) {
        this.values = values;
    }

    public static SimilarityMatrix empty() {
        return EMPTY;
    }

    /**
     * Builds a matrix from raw pairwise scores. Off-diagonal values are symmetrised
     * and clamped to [0, 1]; the diagonal is forced to 1.
     */
    public static SimilarityMatrix of(double[][] raw) {
        int n = raw.length;
        double[][] values = new double[n][n];

        for (int i = 0; i < n; i++) {
            if (raw[i].length != n) {
                throw new IllegalArgumentException("Similarity matrix must be square, row " + i + " has " + raw[i].length + " columns");
            }
            values[i][i] = 1.0;
            for (int j = 0; j < i; j++) {
                double score = clamp((raw[i][j] + raw[j][i]) / 2.0);
                values[i][j] = score;
                values[j][i] = score;
            }
        }
        return new SimilarityMatrix(values);
    }

    /**
     * Pairwise cosine similarity of dense vectors. Zero vectors are similar to nothing.
     */
    public static SimilarityMatrix cosine(List<double[]> vectors) {
        int n = vectors.size();
        double[] norms = new double[n];
        for (int i = 0; i < n; i++) {
            norms[i] = Math.sqrt(dot(vectors.get(i), vectors.get(i)));
        }

        double[][] raw = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                double denominator = norms[i] * norms[j];
                double score = denominator == 0.0 ? 0.0 : dot(vectors.get(i), vectors.get(j)) / denominator;
                raw[i][j] = score;
                raw[j][i] = score;
            }
        }
        return of(raw);
    }

    /**
     * Pairwise cosine similarity of sparse vectors that are already L2-normalised.
     */
    public static SimilarityMatrix cosineOfNormalized(List<Map<String, Double>> vectors) {
        int n = vectors.size();
        double[][] raw = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                double score = sparseDot(vectors.get(i), vectors.get(j));
                raw[i][j] = score;
                raw[j][i] = score;
            }
        }
        return of(raw);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    /**
     * Distance matrix {@code 1 - similarity}, zero on the diagonal.
     */
    public double[][] toDistances() {
        int n = values.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances[i][j] = i == j ? 0.0 : 1.0 - values[i][j];
            }
        }
        return distances;
    }

    private static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int k = 0; k < a.length; k++) {
            sum += a[k] * b[k];
        }
        return sum;
    }

    private static double sparseDot(Map<String, Double> a, Map<String, Double> b) {
        if (a.size() > b.size()) {
            return sparseDot(b, a);
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> term : a.entrySet()) {
            Double other = b.get(term.getKey());
            if (other != null) {
                sum += term.getValue() * other;
            }
        }
        return sum;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
