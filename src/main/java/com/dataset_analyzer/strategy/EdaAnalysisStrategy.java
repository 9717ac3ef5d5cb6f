package com.dataset_analyzer.strategy;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.ColumnType;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.analysis.EdaSummary;
import com.dataset_analyzer.model.analysis.NumericColumnStats;
import com.dataset_analyzer.model.dataset.BoolValue;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import com.dataset_analyzer.model.dataset.TextValue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exploratory audit: missing values, inferred column types, duplicate rows and
 * descriptive statistics of the numeric columns.
 */
@Slf4j
@Component
public class EdaAnalysisStrategy implements AnalysisStrategy {

    @Override
    public Route route() {
        return Route.EDA;
    }

    @Override
    public EdaSummary analyze(Dataset dataset, DatasetProfile profile, AnalysisConfig config) {
        Map<String, Integer> missing = new LinkedHashMap<>();
        Map<String, ColumnType> types = new LinkedHashMap<>();
        Map<String, NumericColumnStats> stats = new LinkedHashMap<>();
        long totalMissing = 0;

        for (String column : dataset.getColumns()) {
            List<CellValue> values = dataset.columnValues(column);
            int missingCount = (int) values.stream().filter(CellValue::isMissing).count();
            missing.put(column, missingCount);
            totalMissing += missingCount;

            ColumnType type = inferType(column, values, profile);
            types.put(column, type);
            if (type == ColumnType.NUMERIC) {
                stats.put(column, describe(values));
            }
        }

        int duplicates = countDuplicateRows(dataset);
        log.info("EDA analysis of '{}': {} missing values, {} duplicate rows, {} numeric columns",
                dataset.getName(), totalMissing, duplicates, stats.size());

        return new EdaSummary(dataset.rowCount(), dataset.columnCount(), missing, totalMissing,
                duplicates, types, stats);
    }

    /**
     * Every copy of a row after its first occurrence counts as a duplicate.
     */
    public static int countDuplicateRows(Dataset dataset) {
        Set<List<CellValue>> seen = new HashSet<>();
        int duplicates = 0;
        for (List<CellValue> row : dataset.getRows()) {
            if (!seen.add(row)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    private static ColumnType inferType(String column, List<CellValue> values, DatasetProfile profile) {
        if (profile.numericColumns().contains(column)) {
            return ColumnType.NUMERIC;
        }
        boolean sawValue = false;
        for (CellValue value : values) {
            if (value.isMissing()) {
                continue;
            }
            boolean booleanLike = value instanceof BoolValue
                    || (value instanceof TextValue text && text.isBooleanLiteral());
            if (!booleanLike) {
                return ColumnType.TEXT;
            }
            sawValue = true;
        }
        return sawValue ? ColumnType.BOOLEAN : ColumnType.TEXT;
    }

    static NumericColumnStats describe(List<CellValue> values) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        for (CellValue value : values) {
            value.asNumber().ifPresent(stats::addValue);
        }
        return new NumericColumnStats(
                stats.getN(),
                stats.getMean(),
                stats.getStandardDeviation(),
                stats.getMin(),
                stats.getPercentile(25),
                stats.getPercentile(50),
                stats.getPercentile(75),
                stats.getMax());
    }
}
