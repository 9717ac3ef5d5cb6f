package com.dataset_analyzer.agent;

import com.dataset_analyzer.exception.EmptyDatasetException;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the structural metrics used for routing.
 * <p>
 * A column is numeric only when every non-missing value reads as a number; one
 * non-numeric value anywhere disqualifies the column. Columns without any
 * non-missing value are not numeric.
 */
@Slf4j
@Component
public class DatasetProfiler {

    public DatasetProfile profile(Dataset dataset) {
        if (dataset == null || dataset.isEmpty()) {
            throw new EmptyDatasetException();
        }

        List<String> numericColumns = new ArrayList<>();
        for (int col = 0; col < dataset.columnCount(); col++) {
            if (isNumericColumn(dataset, col)) {
                numericColumns.add(dataset.getColumns().get(col));
            }
        }

        double ratio = (double) numericColumns.size() / dataset.columnCount();
        DatasetProfile profile = new DatasetProfile(dataset.rowCount(), dataset.columnCount(), ratio, numericColumns);
        log.debug("Profiled dataset '{}': rows={}, columns={}, numeric={}",
                dataset.getName(), profile.rowCount(), profile.columnCount(), numericColumns);
        return profile;
    }

    public static boolean isNumericColumn(Dataset dataset, int columnIndex) {
        boolean sawValue = false;
        for (List<CellValue> row : dataset.getRows()) {
            CellValue cell = row.get(columnIndex);
            if (cell.isMissing()) {
                continue;
            }
            if (cell.asNumber().isEmpty()) {
                return false;
            }
            sawValue = true;
        }
        return sawValue;
    }
}
