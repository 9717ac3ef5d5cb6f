package com.dataset_analyzer.agent;

import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.DatasetProfile;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an analysis summary into the prompt sent to the text-generation service.
 * The answer layout requested here is the one {@link InsightResponseParser} reads.
 */
public final class InsightPromptBuilder {

    static final String ANSWER_LAYOUT = """
            Write:
            INSIGHTS:
            - insight 1
            - insight 2

            RECOMMENDATION:
            text""";

    private InsightPromptBuilder() {
    }

    public static String build(AnalysisSummary summary, DatasetProfile profile) {
        return build(summary, profile, List.of());
    }

    /**
     * @param preview leading rows of the dataset, rendered one per line after the results
     */
    public static String build(AnalysisSummary summary, DatasetProfile profile, List<Map<String, CellValue>> preview) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analysis: ").append(summary.route().name()).append('\n');
        if (profile != null) {
            prompt.append(String.format(Locale.ROOT, "Dataset: %d rows, %d columns, %.0f%% numeric%n",
                    profile.rowCount(), profile.columnCount(), profile.numericColumnRatio() * 100));
        }
        prompt.append("Results:\n");
        for (Map.Entry<String, Object> entry : summary.describe().entrySet()) {
            prompt.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        if (!preview.isEmpty()) {
            prompt.append("Preview:\n");
            for (Map<String, CellValue> row : preview) {
                prompt.append(row).append('\n');
            }
        }
        prompt.append('\n').append(ANSWER_LAYOUT);
        return prompt.toString();
    }
}
