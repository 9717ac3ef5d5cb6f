package com.dataset_analyzer.util;

import weka.core.Instances;

import java.util.List;

/**
 * Numeric sub-table of a dataset.
 *
 * @param instances      one attribute per numeric column, one instance per complete row
 * @param sourceRows     dataset row index of every instance
 * @param excludedRows   rows dropped because a numeric value was missing
 */
public record NumericTable(Instances instances, List<Integer> sourceRows, int excludedRows) {

    public int size() {
        return instances.numInstances();
    }
}
