package com.dataset_analyzer.unit_tests.service;

import com.dataset_analyzer.agent.DatasetProfiler;
import com.dataset_analyzer.agent.InsightAgent;
import com.dataset_analyzer.agent.RoutingAgent;
import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.dto.request.AnalyzeRequest;
import com.dataset_analyzer.dto.response.AnalyzeResponse;
import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.enumeration.SchemaPolicy;
import com.dataset_analyzer.exception.EmptyDatasetException;
import com.dataset_analyzer.exception.MalformedRowException;
import com.dataset_analyzer.generation.UnavailableTextGenerationClient;
import com.dataset_analyzer.model.analysis.AnalysisRun;
import com.dataset_analyzer.model.analysis.EdaSummary;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.service.AnalysisService;
import com.dataset_analyzer.service.DatasetAssembler;
import com.dataset_analyzer.service.orchestrator.AnalysisOrchestrator;
import com.dataset_analyzer.service.orchestrator.CancellationCheck;
import com.dataset_analyzer.strategy.AnalysisStrategyResolver;
import com.dataset_analyzer.strategy.EdaAnalysisStrategy;
import com.dataset_analyzer.strategy.MlAnalysisStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the real pipeline with text generation switched off.
 */
class AnalysisServiceTest {

    private static AnalysisService service(AnalysisConfig config) {
        AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                new DatasetProfiler(),
                new RoutingAgent(),
                new AnalysisStrategyResolver(new MlAnalysisStrategy(), new EdaAnalysisStrategy()),
                new InsightAgent(new UnavailableTextGenerationClient("disabled in tests"), Runnable::run));
        return new AnalysisService(new DatasetAssembler(new ObjectMapper()), orchestrator, config);
    }

    private static List<Map<String, Object>> sensorRows(int count) {
        Random random = new Random(21);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("temperature", 20 + random.nextGaussian() * 3);
            row.put("humidity", 50 + random.nextGaussian() * 10);
            row.put("pressure", 1013 + random.nextGaussian() * 5);
            row.put("site", "site-" + (i % 4));
            rows.add(row);
        }
        return rows;
    }

    private static AnalyzeRequest request(List<Map<String, Object>> rows) {
        return AnalyzeRequest.builder().datasetName("sensors").rows(rows).build();
    }

    @Test
    void shouldRouteSmallDatasetToEdaWithTemplateInsights() {
        AnalyzeResponse response = service(AnalysisConfig.defaults()).analyze(request(sensorRows(12)));

        assertThat(response.getRunId()).isNotNull();
        assertThat(response.getRoute()).isEqualTo(Route.EDA);
        assertThat(response.getSummary()).isInstanceOf(EdaSummary.class);
        assertThat(response.getInsightSource()).isEqualTo(InsightSource.FALLBACK);
        assertThat(response.getInsights()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(response.getRecommendation()).isNotBlank();
        assertThat(response.isFallbackApplied()).isFalse();
    }

    @Test
    void shouldRouteLargeNumericDatasetToMl() {
        AnalysisRun run = service(AnalysisConfig.defaults()).run(request(sensorRows(600)), CancellationCheck.NEVER);

        assertThat(run.getRoute()).isEqualTo(Route.ML);
        MlSummary summary = (MlSummary) run.getSummary();
        assertThat(summary.outlierCount()).isEqualTo(60);
        assertThat(summary.outlierPercent()).isEqualTo(10.0);
        assertThat(run.getReport().route()).isEqualTo(Route.ML);
    }

    @Test
    void shouldFallBackToEda_WhenNoCompleteNumericRowRemains() {
        List<Map<String, Object>> rows = sensorRows(600);
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put(i % 2 == 0 ? "temperature" : "humidity", null);
        }

        AnalysisRun run = service(AnalysisConfig.defaults()).run(request(rows), CancellationCheck.NEVER);

        assertThat(run.getDecision().route()).isEqualTo(Route.ML);
        assertThat(run.getRoute()).isEqualTo(Route.EDA);
        assertThat(run.isFallbackApplied()).isTrue();
    }

    @Test
    void shouldAuditTenRowsWithTwoNumericColumnsOfFive() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("age", 20 + i);
            row.put("income", i == 4 ? null : 1000.0 * i);
            row.put("name", "person-" + i);
            row.put("member", i % 2 == 0);
            row.put("city", i % 3 == 0 ? "" : "Athens");
            rows.add(row);
        }

        AnalysisRun run = service(AnalysisConfig.defaults()).run(request(rows), CancellationCheck.NEVER);

        assertThat(run.getProfile().numericColumnRatio()).isEqualTo(0.4);
        assertThat(run.getRoute()).isEqualTo(Route.EDA);
        EdaSummary summary = (EdaSummary) run.getSummary();
        assertThat(summary.missingValueCounts()).containsOnlyKeys("age", "income", "name", "member", "city");
        assertThat(summary.missingValueCounts()).containsEntry("income", 1).containsEntry("city", 4);
        assertThat(run.getReport().insights()).isNotEmpty();
    }

    @Test
    void shouldFailOnEmptyRows() {
        assertThatThrownBy(() -> service(AnalysisConfig.defaults()).analyze(request(List.of())))
                .isInstanceOf(EmptyDatasetException.class);
    }

    @Test
    void shouldApplyConfiguredSchemaPolicy() {
        List<Map<String, Object>> rows = sensorRows(10);
        rows.get(3).remove("site");

        assertThatThrownBy(() -> service(AnalysisConfig.defaults()).analyze(request(rows)))
                .isInstanceOf(MalformedRowException.class);

        AnalysisConfig dropping = AnalysisConfig.defaults().toBuilder().schemaPolicy(SchemaPolicy.DROP).build();
        AnalysisRun run = service(dropping).run(request(rows), CancellationCheck.NEVER);
        assertThat(run.getDroppedRowCount()).isEqualTo(1);
        assertThat(run.getProfile().rowCount()).isEqualTo(9);
    }
}
