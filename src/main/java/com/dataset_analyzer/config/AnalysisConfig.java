package com.dataset_analyzer.config;

import com.dataset_analyzer.enumeration.SchemaPolicy;
import lombok.Builder;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of one analysis run. Passed explicitly to every pipeline stage so that
 * concurrent runs never read shared configuration state.
 */
@Builder(toBuilder = true)
public record AnalysisConfig(
        int mlMinRows,
        double mlMinNumericRatio,
        double contamination,
        int minClusters,
        int maxClusters,
        long randomSeed,
        int isolationTrees,
        int isolationSubsampleSize,
        int silhouetteSampleSize,
        int maxInsights,
        Duration insightTimeout,
        SchemaPolicy schemaPolicy
) {

    public AnalysisConfig {
        Objects.requireNonNull(insightTimeout, "insightTimeout");
        Objects.requireNonNull(schemaPolicy, "schemaPolicy");
        if (mlMinRows < 0) {
            throw new IllegalArgumentException("mlMinRows must not be negative");
        }
        if (mlMinNumericRatio < 0 || mlMinNumericRatio > 1) {
            throw new IllegalArgumentException("mlMinNumericRatio must be within [0, 1]");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be within (0, 0.5]");
        }
        if (minClusters < 2 || maxClusters < minClusters) {
            throw new IllegalArgumentException("cluster range must satisfy 2 <= min <= max");
        }
        if (isolationTrees < 1 || isolationSubsampleSize < 2) {
            throw new IllegalArgumentException("isolation forest needs at least one tree and a subsample of 2");
        }
        if (silhouetteSampleSize < 2) {
            throw new IllegalArgumentException("silhouetteSampleSize must be at least 2");
        }
        if (maxInsights < 1) {
            throw new IllegalArgumentException("maxInsights must be at least 1");
        }
        if (insightTimeout.isNegative() || insightTimeout.isZero()) {
            throw new IllegalArgumentException("insightTimeout must be positive");
        }
    }

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder()
                .mlMinRows(500)
                .mlMinNumericRatio(0.5)
                .contamination(0.1)
                .minClusters(2)
                .maxClusters(4)
                .randomSeed(42L)
                .isolationTrees(100)
                .isolationSubsampleSize(256)
                .silhouetteSampleSize(2000)
                .maxInsights(5)
                .insightTimeout(Duration.ofSeconds(15))
                .schemaPolicy(SchemaPolicy.REJECT)
                .build();
    }
}
