package com.dataset_analyzer.ml;

/**
 * Outcome of the adaptive k-means search.
 *
 * @param clusterCount number of non-empty clusters
 * @param assignments  cluster index per input row, in [0, clusterCount)
 * @param silhouette   mean silhouette of this partition
 */
public record ClusteringResult(int clusterCount, int[] assignments, double silhouette) {
}
