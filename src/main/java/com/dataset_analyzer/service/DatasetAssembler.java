package com.dataset_analyzer.service;

import com.dataset_analyzer.enumeration.SchemaPolicy;
import com.dataset_analyzer.exception.MalformedRowException;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.TextValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the immutable {@link Dataset} of a run from inbound JSON rows.
 * <p>
 * The schema is the most frequent key set among the rows (the earliest one wins a tie), with
 * columns in the key order of its first row. Rows with another key set are rejected or dropped
 * according to the {@link SchemaPolicy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetAssembler {

    private final ObjectMapper objectMapper;

    public record AssembledDataset(Dataset dataset, int droppedRows) {
    }

    public AssembledDataset assemble(String name, List<Map<String, Object>> records, SchemaPolicy policy) {
        List<Map<String, Object>> rows = records == null ? List.of() : records;
        List<String> columns = majoritySchema(rows);
        Set<String> expected = new LinkedHashSet<>(columns);

        List<List<CellValue>> accepted = new ArrayList<>(rows.size());
        int dropped = 0;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i) == null ? Map.of() : rows.get(i);
            if (!row.keySet().equals(expected)) {
                if (policy == SchemaPolicy.REJECT) {
                    throw new MalformedRowException(i, expected, new LinkedHashSet<>(row.keySet()));
                }
                dropped++;
                continue;
            }
            List<CellValue> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(toCell(row.get(column)));
            }
            accepted.add(cells);
        }

        if (dropped > 0) {
            log.warn("Dropped {} of {} rows of '{}' that did not match the schema {}", dropped, rows.size(), name, columns);
        }
        return new AssembledDataset(Dataset.of(name, columns, accepted), dropped);
    }

    static List<String> majoritySchema(List<Map<String, Object>> rows) {
        Map<Set<String>, Integer> frequency = new LinkedHashMap<>();
        Map<Set<String>, List<String>> firstOrder = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            if (row == null) {
                continue;
            }
            Set<String> keys = new LinkedHashSet<>(row.keySet());
            frequency.merge(keys, 1, Integer::sum);
            firstOrder.putIfAbsent(keys, new ArrayList<>(row.keySet()));
        }
        Set<String> best = null;
        int bestCount = 0;
        for (Map.Entry<Set<String>, Integer> entry : frequency.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? List.of() : firstOrder.get(best);
    }

    private CellValue toCell(Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            try {
                return new TextValue(objectMapper.writeValueAsString(raw));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot serialize nested value " + raw, e);
            }
        }
        return CellValue.of(raw);
    }
}
