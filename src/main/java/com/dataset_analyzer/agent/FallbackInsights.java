package com.dataset_analyzer.agent;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.dataset_analyzer.model.analysis.EdaSummary;
import com.dataset_analyzer.model.analysis.InsightReport;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.model.analysis.NumericColumnStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Template insights built from the numeric fields of a summary alone.
 * Used whenever text generation is unavailable; output depends only on the summary and config.
 */
public final class FallbackInsights {

    private FallbackInsights() {
    }

    public static InsightReport report(AnalysisSummary summary, AnalysisConfig config) {
        List<String> insights = insights(summary);
        return new InsightReport(insights.subList(0, Math.min(insights.size(), config.maxInsights())),
                recommendation(summary, config), summary.route(), InsightSource.FALLBACK);
    }

    public static List<String> insights(AnalysisSummary summary) {
        if (summary instanceof MlSummary ml) {
            return mlInsights(ml);
        }
        return edaInsights((EdaSummary) summary);
    }

    public static String recommendation(AnalysisSummary summary, AnalysisConfig config) {
        if (summary instanceof MlSummary ml) {
            return mlRecommendation(ml);
        }
        return edaRecommendation((EdaSummary) summary, config);
    }

    /**
     * Insight line stating how many rows the ML route left out, or {@code null} when none were.
     */
    public static String exclusionNote(MlSummary ml) {
        if (ml.excludedRowCount() == 0) {
            return null;
        }
        return String.format(Locale.ROOT, "%d rows with missing numeric values were excluded from the ML analysis; %d rows were analyzed.",
                ml.excludedRowCount(), ml.analyzedRowCount());
    }

    private static List<String> mlInsights(MlSummary ml) {
        List<String> insights = new ArrayList<>();
        insights.add(String.format(Locale.ROOT, "Dataset has %.2f%% outliers (%d rows flagged as anomalous).",
                ml.outlierPercent(), ml.outlierCount()));

        Map.Entry<String, Integer> largest = ml.clusterDistribution().entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey(Comparator.reverseOrder())))
                .orElse(null);
        if (largest != null && ml.analyzedRowCount() > 0) {
            insights.add(String.format(Locale.ROOT, "Identified %d groups; the largest, %s, holds %d rows (%.1f%% of analyzed rows).",
                    ml.clusterCount(), largest.getKey(), largest.getValue(),
                    100.0 * largest.getValue() / ml.analyzedRowCount()));
        } else {
            insights.add(String.format(Locale.ROOT, "Identified %d groups.", ml.clusterCount()));
        }

        insights.add(String.format(Locale.ROOT, "Group separation is %s (silhouette %.2f).",
                separationLabel(ml.silhouetteScore()), ml.silhouetteScore()));

        String exclusion = exclusionNote(ml);
        if (exclusion != null) {
            insights.add(exclusion);
        }
        return insights;
    }

    private static String mlRecommendation(MlSummary ml) {
        if (ml.silhouetteScore() > 0.5) {
            return String.format(Locale.ROOT, "Review the %d flagged outliers, then profile the %d well-separated groups as candidate segments.",
                    ml.outlierCount(), ml.clusterCount());
        }
        return String.format(Locale.ROOT, "Review the %d flagged outliers; the %d groups overlap, so refine the feature set before relying on the segmentation.",
                ml.outlierCount(), ml.clusterCount());
    }

    private static List<String> edaInsights(EdaSummary eda) {
        List<String> insights = new ArrayList<>();
        insights.add(String.format(Locale.ROOT, "Dataset has %d rows and %d columns, %d of them numeric.",
                eda.rowCount(), eda.columnCount(), eda.numericColumnCount()));

        if (eda.totalMissingValues() > 0) {
            Map.Entry<String, Integer> worst = eda.missingValueCounts().entrySet().stream()
                    .reduce((best, next) -> next.getValue() > best.getValue() ? next : best)
                    .orElseThrow();
            insights.add(String.format(Locale.ROOT, "%d missing values found; column '%s' has the most (%d).",
                    eda.totalMissingValues(), worst.getKey(), worst.getValue()));
        } else {
            insights.add("No missing values detected.");
        }

        if (eda.duplicateRowCount() > 0) {
            insights.add(String.format(Locale.ROOT, "%d duplicate rows found (%.1f%% of the dataset).",
                    eda.duplicateRowCount(), 100.0 * eda.duplicateRowCount() / Math.max(1, eda.rowCount())));
        } else {
            insights.add("No duplicate rows found.");
        }

        eda.numericStats().entrySet().stream().findFirst().ifPresent(entry -> {
            NumericColumnStats stats = entry.getValue();
            insights.add(String.format(Locale.ROOT, "Column '%s' ranges from %.2f to %.2f (mean %.2f, std %.2f).",
                    entry.getKey(), stats.min(), stats.max(), stats.mean(), stats.std()));
        });
        return insights;
    }

    private static String edaRecommendation(EdaSummary eda, AnalysisConfig config) {
        boolean missing = eda.totalMissingValues() > 0;
        boolean duplicates = eda.duplicateRowCount() > 0;
        if (missing && duplicates) {
            return "Remove duplicate rows and impute or drop missing values before further analysis.";
        }
        if (duplicates) {
            return "Remove duplicate rows before further analysis.";
        }
        if (missing) {
            return "Impute or drop missing values before further analysis.";
        }
        if (eda.rowCount() <= config.mlMinRows()) {
            return String.format(Locale.ROOT, "Data looks clean; collect more than %d rows to enable anomaly detection and clustering.",
                    config.mlMinRows());
        }
        return "Data looks clean; increase the share of numeric columns to enable anomaly detection and clustering.";
    }

    private static String separationLabel(double silhouette) {
        if (silhouette > 0.5) {
            return "strong";
        }
        if (silhouette > 0.25) {
            return "moderate";
        }
        return "weak";
    }
}
