package com.dataset_analyzer.model.dataset;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Structural metrics the routing agent decides on.
 *
 * @param rowCount           number of rows
 * @param columnCount        number of columns
 * @param numericColumnRatio numeric columns divided by all columns, in [0, 1]
 * @param numericColumns     names of the numeric columns, in dataset order
 */
public record DatasetProfile(int rowCount, int columnCount, double numericColumnRatio, List<String> numericColumns) {

    public DatasetProfile {
        numericColumns = List.copyOf(numericColumns);
    }

    @JsonIgnore
    public int numericColumnCount() {
        return numericColumns.size();
    }
}
