package com.dataset_analyzer.util;

import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.Standardize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Conversions between {@link Dataset} and Weka {@link Instances}.
 */
public class DatasetUtil {
    private static final Logger logger = LoggerFactory.getLogger(DatasetUtil.class);

    private DatasetUtil() {
    }

    /**
     * Extracts the given numeric columns. Rows with any missing value in those columns are
     * dropped and counted rather than imputed.
     */
    public static NumericTable toNumericTable(Dataset dataset, List<String> numericColumns) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        int[] columnIndices = new int[numericColumns.size()];
        for (int i = 0; i < numericColumns.size(); i++) {
            attributes.add(new Attribute(numericColumns.get(i)));
            columnIndices[i] = dataset.columnIndex(numericColumns.get(i));
        }

        Instances instances = new Instances(safeRelationName(dataset), attributes, dataset.rowCount());
        List<Integer> sourceRows = new ArrayList<>();
        int excluded = 0;

        rows:
        for (int r = 0; r < dataset.rowCount(); r++) {
            List<CellValue> row = dataset.getRows().get(r);
            double[] values = new double[columnIndices.length];
            for (int c = 0; c < columnIndices.length; c++) {
                Optional<Double> number = row.get(columnIndices[c]).asNumber();
                if (number.isEmpty()) {
                    excluded++;
                    continue rows;
                }
                values[c] = number.get();
            }
            instances.add(new DenseInstance(1.0, values));
            sourceRows.add(r);
        }

        if (excluded > 0) {
            logger.info("Excluded {} of {} rows with missing numeric values", excluded, dataset.rowCount());
        }
        return new NumericTable(instances, Collections.unmodifiableList(sourceRows), excluded);
    }

    /**
     * Zero mean and unit variance per attribute.
     */
    public static Instances standardize(Instances data) throws Exception {
        Standardize standardize = new Standardize();
        standardize.setInputFormat(data);
        return Filter.useFilter(data, standardize);
    }

    public static double[][] toMatrix(Instances data) {
        double[][] matrix = new double[data.numInstances()][];
        for (int i = 0; i < data.numInstances(); i++) {
            matrix[i] = data.instance(i).toDoubleArray();
        }
        return matrix;
    }

    private static String safeRelationName(Dataset dataset) {
        String name = dataset.getName();
        return name == null || name.isBlank() ? "dataset" : name;
    }
}
