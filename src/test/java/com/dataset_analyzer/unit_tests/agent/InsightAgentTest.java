package com.dataset_analyzer.unit_tests.agent;

import com.dataset_analyzer.agent.InsightAgent;
import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.exception.GenerationFailureException;
import com.dataset_analyzer.generation.TextGenerationClient;
import com.dataset_analyzer.model.analysis.InsightReport;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InsightAgentTest {

    @Mock
    private TextGenerationClient textGenerationClient;

    private ExecutorService executor;
    private InsightAgent insightAgent;
    private final AnalysisConfig config = AnalysisConfig.defaults();
    private final DatasetProfile profile = new DatasetProfile(1000, 9, 8.0 / 9, List.of("a", "b"));

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        insightAgent = new InsightAgent(textGenerationClient, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static MlSummary mlSummary(int excludedRows) {
        int analyzed = 1000 - excludedRows;
        return new MlSummary(100, 10.0, 3, Map.of("C0", analyzed / 2, "C1", analyzed / 4, "C2", analyzed - analyzed / 2 - analyzed / 4),
                0.61, analyzed, excludedRows, List.of("a", "b"));
    }

    @Test
    @DisplayName("Should use generated bullets and recommendation")
    void generate_UsesGeneratedText() {
        when(textGenerationClient.generate(anyString(), any(Duration.class)))
                .thenReturn("INSIGHTS:\n- Ten percent of rows are anomalous.\n- Three groups emerge.\nRECOMMENDATION: Review the anomalies.");

        InsightReport report = insightAgent.generate(mlSummary(0), profile, config);

        assertThat(report.source()).isEqualTo(InsightSource.GENERATED);
        assertThat(report.route()).isEqualTo(Route.ML);
        assertThat(report.insights()).containsExactly("Ten percent of rows are anomalous.", "Three groups emerge.");
        assertThat(report.recommendation()).isEqualTo("Review the anomalies.");
    }

    @Test
    @DisplayName("Should pass the summary figures and the configured timeout to the client")
    void generate_PromptCarriesSummary() {
        when(textGenerationClient.generate(anyString(), any(Duration.class))).thenReturn("- fine\nRECOMMENDATION: ok");

        insightAgent.generate(mlSummary(0), profile, config);

        verify(textGenerationClient).generate(argThat(prompt -> prompt.contains("outlier") && prompt.contains("RECOMMENDATION")),
                eq(config.insightTimeout()));
    }

    @Test
    @DisplayName("Should fall back to templates when the client fails")
    void generate_FallsBackOnFailure() {
        when(textGenerationClient.generate(anyString(), any(Duration.class)))
                .thenThrow(new GenerationFailureException("boom"));

        InsightReport report = insightAgent.generate(mlSummary(0), profile, config);

        assertThat(report.source()).isEqualTo(InsightSource.FALLBACK);
        assertThat(report.insights()).isNotEmpty().hasSizeLessThanOrEqualTo(config.maxInsights());
        assertThat(report.insights().get(0)).contains("10.00%");
        assertThat(report.recommendation()).isNotBlank();
    }

    @Test
    @DisplayName("Should fall back to templates when the client exceeds the timeout")
    void generate_FallsBackOnTimeout() {
        when(textGenerationClient.generate(anyString(), any(Duration.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "- too late";
        });
        AnalysisConfig impatient = config.toBuilder().insightTimeout(Duration.ofMillis(100)).build();

        long started = System.nanoTime();
        InsightReport report = insightAgent.generate(mlSummary(0), profile, impatient);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(report.source()).isEqualTo(InsightSource.FALLBACK);
        assertThat(elapsedMillis).isLessThan(4_000);
    }

    @Test
    @DisplayName("Should fall back when the generated text has no bullet lines")
    void generate_FallsBackWithoutBullets() {
        when(textGenerationClient.generate(anyString(), any(Duration.class))).thenReturn("Everything looks fine to me.");

        InsightReport report = insightAgent.generate(mlSummary(0), profile, config);

        assertThat(report.source()).isEqualTo(InsightSource.FALLBACK);
    }

    @Test
    @DisplayName("Should use the template recommendation when the generated one is missing")
    void generate_TemplateRecommendationWhenMissing() {
        when(textGenerationClient.generate(anyString(), any(Duration.class))).thenReturn("- only an insight");

        InsightReport report = insightAgent.generate(mlSummary(0), profile, config);

        assertThat(report.source()).isEqualTo(InsightSource.GENERATED);
        assertThat(report.recommendation()).contains("100 flagged outliers");
    }

    @Test
    @DisplayName("Should always state excluded rows within the insight limit")
    void generate_AppendsExclusionNote() {
        when(textGenerationClient.generate(anyString(), any(Duration.class)))
                .thenReturn("- one\n- two\n- three\n- four\n- five\n- six\nRECOMMENDATION: act");

        InsightReport report = insightAgent.generate(mlSummary(40), profile, config);

        assertThat(report.insights()).hasSize(config.maxInsights());
        assertThat(report.insights()).startsWith("one", "two", "three", "four");
        assertThat(report.insights().get(4)).contains("40 rows with missing numeric values");
    }
}
