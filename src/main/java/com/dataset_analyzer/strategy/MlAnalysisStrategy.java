package com.dataset_analyzer.strategy;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.exception.InsufficientDataException;
import com.dataset_analyzer.ml.AdaptiveKMeans;
import com.dataset_analyzer.ml.ClusteringResult;
import com.dataset_analyzer.ml.OutlierDetector;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import com.dataset_analyzer.util.DatasetUtil;
import com.dataset_analyzer.util.NumericTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import weka.core.Instances;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anomaly detection and unsupervised grouping over the numeric columns.
 * <ol>
 *   <li>Rows missing any numeric value are excluded.</li>
 *   <li>Features are standardized.</li>
 *   <li>k-means runs for every k in the configured range; the best silhouette wins.</li>
 *   <li>An isolation forest flags the {@code contamination} share of the remaining rows.</li>
 * </ol>
 * Both the forest and k-means use the configured seed. Too few distinct rows to cluster is reported as
 * {@link InsufficientDataException} so the run can continue on the EDA route.
 */
@Slf4j
@Component
public class MlAnalysisStrategy implements AnalysisStrategy {

    @Override
    public Route route() {
        return Route.ML;
    }

    @Override
    public MlSummary analyze(Dataset dataset, DatasetProfile profile, AnalysisConfig config) {
        if (profile.numericColumns().isEmpty()) {
            throw new InsufficientDataException("Dataset has no numeric columns");
        }

        NumericTable table = DatasetUtil.toNumericTable(dataset, profile.numericColumns());
        if (table.size() < config.minClusters()) {
            throw new InsufficientDataException("Only " + table.size() + " complete numeric rows remain, at least "
                    + config.minClusters() + " are required");
        }

        Instances standardized;
        try {
            standardized = DatasetUtil.standardize(table.instances());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to standardize numeric features", e);
        }
        double[][] points = DatasetUtil.toMatrix(standardized);

        ClusteringResult clustering;
        try {
            clustering = new AdaptiveKMeans(config.minClusters(), config.maxClusters(),
                    config.randomSeed(), config.silhouetteSampleSize())
                    .fit(standardized, points);
        } catch (InsufficientDataException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("k-means clustering failed", e);
        }

        int outlierCount = detectOutliers(points, config);
        double outlierPercent = round2((double) outlierCount / dataset.rowCount() * 100);

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (int c = 0; c < clustering.clusterCount(); c++) {
            distribution.put(clusterLabel(c), 0);
        }
        for (int assignment : clustering.assignments()) {
            distribution.merge(clusterLabel(assignment), 1, Integer::sum);
        }

        log.info("ML analysis of '{}': {} outliers ({}%), {} clusters (silhouette {}), {} rows excluded",
                dataset.getName(), outlierCount, outlierPercent, clustering.clusterCount(),
                String.format("%.3f", clustering.silhouette()), table.excludedRows());

        return new MlSummary(
                outlierCount,
                outlierPercent,
                clustering.clusterCount(),
                distribution,
                round4(clustering.silhouette()),
                table.size(),
                table.excludedRows(),
                profile.numericColumns());
    }

    private int detectOutliers(double[][] points, AnalysisConfig config) {
        boolean[] flagged = new OutlierDetector(config.isolationTrees(), config.isolationSubsampleSize(), config.randomSeed())
                .flag(points, config.contamination());
        int count = 0;
        for (boolean isOutlier : flagged) {
            if (isOutlier) {
                count++;
            }
        }
        return count;
    }

    static String clusterLabel(int cluster) {
        return "C" + cluster;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
