package com.dataset_analyzer.ml;

import java.util.Arrays;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Mean silhouette coefficient over Euclidean distances.
 * Large inputs are scored on a seeded random sample so the cost stays quadratic in the sample size.
 */
public final class SilhouetteScore {

    private SilhouetteScore() {
    }

    public static double compute(double[][] points, int[] assignments, int sampleSize, long seed) {
        if (points.length != assignments.length) {
            throw new IllegalArgumentException("points and assignments differ in length");
        }
        int[] sample = sample(points.length, sampleSize, seed);
        int numClusters = Arrays.stream(assignments).max().orElse(-1) + 1;
        if (numClusters < 2 || sample.length < 2) {
            return 0;
        }

        double total = 0;
        for (int i : sample) {
            double[] distanceSums = new double[numClusters];
            int[] counts = new int[numClusters];
            for (int j : sample) {
                if (i == j) {
                    continue;
                }
                distanceSums[assignments[j]] += distance(points[i], points[j]);
                counts[assignments[j]]++;
            }
            int own = assignments[i];
            if (counts[own] == 0) {
                // singleton cluster within the sample
                continue;
            }
            double a = distanceSums[own] / counts[own];
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < numClusters; c++) {
                if (c != own && counts[c] > 0) {
                    b = Math.min(b, distanceSums[c] / counts[c]);
                }
            }
            if (Double.isInfinite(b)) {
                continue;
            }
            double denominator = Math.max(a, b);
            total += denominator == 0 ? 0 : (b - a) / denominator;
        }
        return total / sample.length;
    }

    static double distance(double[] x, double[] y) {
        double sum = 0;
        for (int d = 0; d < x.length; d++) {
            double diff = x[d] - y[d];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static int[] sample(int population, int sampleSize, long seed) {
        if (population <= sampleSize) {
            return IntStream.range(0, population).toArray();
        }
        int[] indices = IntStream.range(0, population).toArray();
        Random random = new Random(seed);
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] chosen = Arrays.copyOf(indices, sampleSize);
        Arrays.sort(chosen);
        return chosen;
    }
}
