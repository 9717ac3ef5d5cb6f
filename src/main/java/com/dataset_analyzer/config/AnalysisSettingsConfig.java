package com.dataset_analyzer.config;

import com.dataset_analyzer.enumeration.SchemaPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class AnalysisSettingsConfig {

    @Value("${analysis.routing.min-rows:500}")
    private int mlMinRows;

    @Value("${analysis.routing.min-numeric-ratio:0.5}")
    private double mlMinNumericRatio;

    @Value("${analysis.ml.contamination:0.1}")
    private double contamination;

    @Value("${analysis.ml.min-clusters:2}")
    private int minClusters;

    @Value("${analysis.ml.max-clusters:4}")
    private int maxClusters;

    @Value("${analysis.ml.random-seed:42}")
    private long randomSeed;

    @Value("${analysis.ml.trees:100}")
    private int isolationTrees;

    @Value("${analysis.ml.subsample-size:256}")
    private int isolationSubsampleSize;

    @Value("${analysis.ml.silhouette-sample-size:2000}")
    private int silhouetteSampleSize;

    @Value("${analysis.insight.max-insights:5}")
    private int maxInsights;

    @Value("${analysis.insight.timeout:15s}")
    private Duration insightTimeout;

    @Value("${analysis.schema-policy:REJECT}")
    private SchemaPolicy schemaPolicy;

    @Bean
    public AnalysisConfig analysisConfig() {
        AnalysisConfig config = AnalysisConfig.builder()
                .mlMinRows(mlMinRows)
                .mlMinNumericRatio(mlMinNumericRatio)
                .contamination(contamination)
                .minClusters(minClusters)
                .maxClusters(maxClusters)
                .randomSeed(randomSeed)
                .isolationTrees(isolationTrees)
                .isolationSubsampleSize(isolationSubsampleSize)
                .silhouetteSampleSize(silhouetteSampleSize)
                .maxInsights(maxInsights)
                .insightTimeout(insightTimeout)
                .schemaPolicy(schemaPolicy)
                .build();
        log.info("Analysis config: ML when rows > {} and numeric ratio > {}, contamination={}, k in [{}, {}], seed={}, schema policy={}",
                mlMinRows, mlMinNumericRatio, contamination, minClusters, maxClusters, randomSeed, schemaPolicy);
        return config;
    }
}
