package com.dataset_analyzer.unit_tests.strategy;

import com.dataset_analyzer.agent.DatasetProfiler;
import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.exception.InsufficientDataException;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import com.dataset_analyzer.strategy.MlAnalysisStrategy;
import com.dataset_analyzer.unit_tests.TestDatasets;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dataset_analyzer.unit_tests.TestDatasets.row;
import static org.assertj.core.api.Assertions.*;

class MlAnalysisStrategyTest {

    private final MlAnalysisStrategy strategy = new MlAnalysisStrategy();
    private final DatasetProfiler profiler = new DatasetProfiler();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    @Test
    void shouldFlagContaminationShareAndClusterEveryRow() {
        Dataset dataset = TestDatasets.blobs(1000, 8, 7L);
        DatasetProfile profile = profiler.profile(dataset);

        MlSummary summary = strategy.analyze(dataset, profile, config);

        assertThat(profile.numericColumnRatio()).isCloseTo(0.889, within(0.001));
        assertThat(summary.outlierCount()).isEqualTo(100);
        assertThat(summary.outlierPercent()).isEqualTo(10.0);
        assertThat(summary.clusterCount()).isBetween(2, 4);
        assertThat(summary.clusterDistribution()).hasSize(summary.clusterCount());
        assertThat(summary.clusterDistribution()).containsKey("C0");
        assertThat(summary.clusterDistribution().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(1000);
        assertThat(summary.silhouetteScore()).isBetween(-1.0, 1.0);
        assertThat(summary.analyzedRowCount()).isEqualTo(1000);
        assertThat(summary.excludedRowCount()).isZero();
        assertThat(summary.featureColumns()).hasSize(8).doesNotContain("label");
    }

    @Test
    void shouldProduceIdenticalSummaries_ForIdenticalInput() {
        Dataset dataset = TestDatasets.blobs(600, 3, 3L);
        DatasetProfile profile = profiler.profile(dataset);

        MlSummary first = strategy.analyze(dataset, profile, config);
        MlSummary second = strategy.analyze(dataset, profile, config);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldExcludeRowsWithMissingNumericValues() {
        Dataset complete = TestDatasets.blobs(600, 3, 11L);
        List<List<CellValue>> rows = new ArrayList<>();
        for (int r = 0; r < complete.rowCount(); r++) {
            List<CellValue> cells = new ArrayList<>(complete.getRows().get(r));
            if (r < 50) {
                cells.set(0, CellValue.of(null));
            }
            rows.add(cells);
        }
        Dataset dataset = Dataset.of("gappy", complete.getColumns(), rows);

        MlSummary summary = strategy.analyze(dataset, profiler.profile(dataset), config);

        assertThat(summary.analyzedRowCount()).isEqualTo(550);
        assertThat(summary.excludedRowCount()).isEqualTo(50);
        assertThat(summary.outlierCount()).isEqualTo(55);
        assertThat(summary.outlierPercent()).isEqualTo(9.17);
        assertThat(summary.clusterDistribution().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(550);
    }

    @Test
    void shouldRefuse_WhenNoCompleteNumericRows() {
        Dataset dataset = Dataset.of("holes", List.of("a", "b"), List.of(
                row(1.0, null),
                row(null, 2.0),
                row(3.0, null)));

        assertThatThrownBy(() -> strategy.analyze(dataset, profiler.profile(dataset), config))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void shouldRefuse_WhenEveryRowIsTheSamePoint() {
        List<List<CellValue>> rows = new ArrayList<>();
        for (int i = 0; i < 600; i++) {
            rows.add(row(1.0, 2.0, "x"));
        }
        Dataset dataset = Dataset.of("constant", List.of("a", "b", "label"), rows);

        assertThatThrownBy(() -> strategy.analyze(dataset, profiler.profile(dataset), config))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("distinct");
    }

    @Test
    void shouldCapClusterCountAtDistinctPoints() {
        List<List<CellValue>> rows = new ArrayList<>();
        for (int i = 0; i < 600; i++) {
            rows.add(row(i % 2 == 0 ? 0.0 : 5.0, 1.0));
        }
        Dataset dataset = Dataset.of("two-points", List.of("a", "b"), rows);

        MlSummary summary = strategy.analyze(dataset, profiler.profile(dataset), config);

        assertThat(summary.clusterCount()).isEqualTo(2);
        assertThat(summary.clusterDistribution()).containsOnly(entry("C0", 300), entry("C1", 300));
        assertThat(summary.outlierCount()).isEqualTo(60);
        assertThat(summary.outlierPercent()).isEqualTo(10.0);
    }

    @Test
    void shouldRefuse_WhenNoNumericColumns() {
        Dataset dataset = Dataset.of("words", List.of("w"), List.of(row("a"), row("b")));

        assertThatThrownBy(() -> strategy.analyze(dataset, profiler.profile(dataset), config))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("no numeric columns");
    }
}
