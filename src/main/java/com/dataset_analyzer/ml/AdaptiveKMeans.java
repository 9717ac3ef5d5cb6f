package com.dataset_analyzer.ml;

import com.dataset_analyzer.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import weka.clusterers.SimpleKMeans;
import weka.core.EuclideanDistance;
import weka.core.Instances;
import weka.core.SelectedTag;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs Weka's {@link SimpleKMeans} for every k in a closed range and keeps the
 * partition with the best silhouette. Ties keep the smaller k. Centers are seeded with k-means++.
 */
@Slf4j
public final class AdaptiveKMeans {

    private final int minClusters;
    private final int maxClusters;
    private final long seed;
    private final int silhouetteSampleSize;

    public AdaptiveKMeans(int minClusters, int maxClusters, long seed, int silhouetteSampleSize) {
        this.minClusters = minClusters;
        this.maxClusters = maxClusters;
        this.seed = seed;
        this.silhouetteSampleSize = silhouetteSampleSize;
    }

    /**
     * @param standardized feature table without a class attribute, already standardized
     * @param points       the same values as a dense matrix, row-aligned with {@code standardized}
     * @throws InsufficientDataException when fewer distinct rows than the minimum cluster count exist
     */
    public ClusteringResult fit(Instances standardized, double[][] points) throws Exception {
        int rows = standardized.numInstances();
        if (rows < minClusters) {
            throw new IllegalArgumentException("Need at least " + minClusters + " rows to cluster, got " + rows);
        }
        int distinct = distinctRows(points);
        if (distinct < minClusters) {
            throw new InsufficientDataException("Only " + distinct + " distinct numeric rows, at least "
                    + minClusters + " are required for clustering");
        }
        // k may not exceed the row count; with exactly minClusters rows k = rows is the only option.
        // k-means++ cannot seed more centers than there are distinct points.
        int upper = Math.min(Math.min(maxClusters, Math.max(minClusters, rows - 1)), distinct);

        ClusteringResult best = null;
        for (int k = minClusters; k <= upper; k++) {
            ClusteringResult candidate = cluster(standardized, points, k);
            log.debug("k={} gave {} non-empty clusters, silhouette={}", k, candidate.clusterCount(), candidate.silhouette());
            if (best == null || candidate.silhouette() > best.silhouette()) {
                best = candidate;
            }
        }
        return best;
    }

    private ClusteringResult cluster(Instances standardized, double[][] points, int k) throws Exception {
        SimpleKMeans kMeans = new SimpleKMeans();
        kMeans.setNumClusters(k);
        kMeans.setSeed((int) seed);
        kMeans.setInitializationMethod(new SelectedTag(SimpleKMeans.KMEANS_PLUS_PLUS, SimpleKMeans.TAGS_SELECTION));
        kMeans.setPreserveInstancesOrder(true);
        EuclideanDistance distance = new EuclideanDistance();
        distance.setDontNormalize(true);
        kMeans.setDistanceFunction(distance);
        kMeans.buildClusterer(standardized);

        int[] assignments = compact(kMeans.getAssignments());
        int nonEmpty = Arrays.stream(assignments).max().orElse(-1) + 1;
        double silhouette = nonEmpty < 2
                ? -1
                : SilhouetteScore.compute(points, assignments, silhouetteSampleSize, seed);
        return new ClusteringResult(nonEmpty, assignments, silhouette);
    }

    public static int distinctRows(double[][] points) {
        Set<List<Double>> seen = new HashSet<>();
        for (double[] point : points) {
            // -0.0 and 0.0 are the same point
            seen.add(Arrays.stream(point).map(v -> v == 0.0 ? 0.0 : v).boxed().collect(Collectors.toList()));
        }
        return seen.size();
    }

    /**
     * Relabels the non-empty clusters as 0..m-1, keeping Weka's label order.
     */
    private static int[] compact(int[] raw) {
        int maxLabel = Arrays.stream(raw).max().orElse(-1);
        int[] mapping = new int[maxLabel + 1];
        Arrays.fill(mapping, -1);
        int next = 0;
        for (int label = 0; label <= maxLabel; label++) {
            final int current = label;
            if (Arrays.stream(raw).anyMatch(a -> a == current)) {
                mapping[label] = next++;
            }
        }
        int[] compacted = new int[raw.length];
        for (int i = 0; i < raw.length; i++) {
            compacted[i] = mapping[raw[i]];
        }
        return compacted;
    }
}
