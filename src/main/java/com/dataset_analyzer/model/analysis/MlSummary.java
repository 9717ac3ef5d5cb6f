package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.Route;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anomaly and clustering figures of the ML route.
 * {@code outlierPercent} is relative to the original row count, while the cluster
 * distribution only covers the {@code analyzedRowCount} rows that had every numeric value.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MlSummary(
        int outlierCount,
        double outlierPercent,
        int clusterCount,
        Map<String, Integer> clusterDistribution,
        double silhouetteScore,
        int analyzedRowCount,
        int excludedRowCount,
        List<String> featureColumns
) implements AnalysisSummary {

    public MlSummary {
        clusterDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(clusterDistribution));
        featureColumns = List.copyOf(featureColumns);
    }

    @Override
    public Route route() {
        return Route.ML;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("outliers", outlierCount);
        description.put("outlier_percent", outlierPercent);
        description.put("clusters", clusterCount);
        description.put("distribution", clusterDistribution);
        description.put("silhouette", silhouetteScore);
        description.put("analyzed_rows", analyzedRowCount);
        description.put("excluded_rows", excludedRowCount);
        description.put("features", featureColumns);
        return description;
    }
}
