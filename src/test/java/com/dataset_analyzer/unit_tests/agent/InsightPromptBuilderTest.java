package com.dataset_analyzer.unit_tests.agent;

import com.dataset_analyzer.agent.DatasetProfiler;
import com.dataset_analyzer.agent.InsightPromptBuilder;
import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.model.analysis.EdaSummary;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import com.dataset_analyzer.strategy.EdaAnalysisStrategy;
import com.dataset_analyzer.unit_tests.TestDatasets;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InsightPromptBuilderTest {

    private final Dataset dataset = TestDatasets.customers();
    private final DatasetProfile profile = new DatasetProfiler().profile(dataset);
    private final EdaSummary summary = new EdaAnalysisStrategy().analyze(dataset, profile, AnalysisConfig.defaults());

    @Test
    void shouldListPreviewRowsAfterResults() {
        String prompt = InsightPromptBuilder.build(summary, profile, dataset.head(3));

        assertThat(prompt).contains("Analysis: EDA", "Results:", "Preview:", "name=ann", "city=Lisbon", "name=cid");
        assertThat(prompt.indexOf("Preview:")).isGreaterThan(prompt.indexOf("Results:"));
        assertThat(prompt.lines().filter(line -> line.startsWith("{"))).hasSize(3);
        assertThat(prompt).endsWith("RECOMMENDATION:\ntext");
    }

    @Test
    void shouldOmitPreviewSection_WhenNoRowsGiven() {
        String prompt = InsightPromptBuilder.build(summary, profile);

        assertThat(prompt).doesNotContain("Preview:");
    }

    @Test
    void headShouldStopAtDatasetLength() {
        assertThat(dataset.head(10)).hasSize(4);
        assertThat(dataset.head(0)).isEmpty();
        assertThat(dataset.head(1).get(0)).containsOnlyKeys("id", "name", "score", "active", "city");
    }
}
