package io.newsclusters.digest.api.service.clustering;

import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Average-linkage agglomerative clustering over a precomputed distance matrix.
 * <p>
 * Clusters are merged bottom-up while the smallest linkage distance stays strictly
 * below the cutoff, so the number of clusters follows from the cutoff alone.
 * Among equal linkage distances the pair with the lowest indexes merges first.
 */
@Component
public class AgglomerativeClusterer {

    /**
     * @param distances symmetric distance matrix with zero diagonal
     * @param cutoff    merges happen only while linkage distance is below this value
     * @return one label per row, numbered 0..k-1 in order of each cluster's first member
     */
    public int[] labels(double[][] distances, double cutoff) {
        int n = distances.length;
        if (n == 0) {
            return new int[0];
        }

        double[][] linkage = new double[n][];
        for (int i = 0; i < n; i++) {
            if (distances[i].length != n) {
                throw new IllegalArgumentException("Distance matrix must be square");
            }
            linkage[i] = Arrays.copyOf(distances[i], n);
        }

        // Each active cluster is represented by its lowest member index.
        int[] parent = new int[n];
        int[] size = new int[n];
        boolean[] active = new boolean[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            size[i] = 1;
            active[i] = true;
        }

        for (int merges = 0; merges < n - 1; merges++) {
            int bestA = -1;
            int bestB = -1;
            double best = Double.POSITIVE_INFINITY;

            for (int a = 0; a < n; a++) {
                if (!active[a]) continue;
                for (int b = a + 1; b < n; b++) {
                    if (active[b] && linkage[a][b] < best) {
                        best = linkage[a][b];
                        bestA = a;
                        bestB = b;
                    }
                }
            }

            if (bestA < 0 || !(best < cutoff)) {
                break;
            }

            // Lance-Williams update for average linkage
            for (int k = 0; k < n; k++) {
                if (!active[k] || k == bestA || k == bestB) continue;
                double merged = (size[bestA] * linkage[bestA][k] + size[bestB] * linkage[bestB][k])
                        / (size[bestA] + size[bestB]);
                linkage[bestA][k] = merged;
                linkage[k][bestA] = merged;
            }

            size[bestA] += size[bestB];
            active[bestB] = false;
            parent[bestB] = bestA;
        }

        int[] labels = new int[n];
        int[] labelOfRoot = new int[n];
        Arrays.fill(labelOfRoot, -1);
        int nextLabel = 0;

        for (int i = 0; i < n; i++) {
            int root = find(parent, i);
            if (labelOfRoot[root] < 0) {
                labelOfRoot[root] = nextLabel++;
            }
            labels[i] = labelOfRoot[root];
        }
        return labels;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            i = parent[i];
        }
        return i;
    }
}
