package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.ColumnType;
import com.dataset_analyzer.enumeration.Route;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exploratory audit of the EDA route. All maps keep dataset column order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EdaSummary(
        int rowCount,
        int columnCount,
        Map<String, Integer> missingValueCounts,
        long totalMissingValues,
        int duplicateRowCount,
        Map<String, ColumnType> columnTypeBreakdown,
        Map<String, NumericColumnStats> numericStats
) implements AnalysisSummary {

    public EdaSummary {
        missingValueCounts = Collections.unmodifiableMap(new LinkedHashMap<>(missingValueCounts));
        columnTypeBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypeBreakdown));
        numericStats = Collections.unmodifiableMap(new LinkedHashMap<>(numericStats));
    }

    @Override
    public Route route() {
        return Route.EDA;
    }

    public long numericColumnCount() {
        return columnTypeBreakdown.values().stream().filter(type -> type == ColumnType.NUMERIC).count();
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("rows", rowCount);
        description.put("columns", columnCount);
        description.put("numeric_columns", numericColumnCount());
        description.put("missing_values", totalMissingValues);
        description.put("missing_by_column", missingValueCounts);
        description.put("duplicates", duplicateRowCount);
        description.put("column_types", columnTypeBreakdown);
        description.put("stats", numericStats);
        return description;
    }
}
