package com.dataset_analyzer.agent;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.exception.GenerationTimeoutException;
import com.dataset_analyzer.generation.TextGenerationClient;
import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.dataset_analyzer.model.analysis.InsightReport;
import com.dataset_analyzer.model.analysis.MlSummary;
import com.dataset_analyzer.model.dataset.CellValue;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns an analysis summary into a few narrative insights and one recommendation.
 * <p>
 * The generation call runs on the generation pool and is bounded by the run's insight timeout.
 * Any failure, timeout or unusable answer falls back to {@link FallbackInsights}, so a report is
 * always produced.
 */
@Slf4j
@Component
public class InsightAgent {

    private final TextGenerationClient textGenerationClient;
    private final Executor generationExecutor;

    public InsightAgent(TextGenerationClient textGenerationClient,
                        @Qualifier("generationExecutor") Executor generationExecutor) {
        this.textGenerationClient = textGenerationClient;
        this.generationExecutor = generationExecutor;
    }

    public InsightReport generate(AnalysisSummary summary, DatasetProfile profile, AnalysisConfig config) {
        return generate(summary, profile, List.of(), config);
    }

    public InsightReport generate(AnalysisSummary summary, DatasetProfile profile,
                                  List<Map<String, CellValue>> preview, AnalysisConfig config) {
        String prompt = InsightPromptBuilder.build(summary, profile, preview);
        Optional<String> generated = requestText(prompt, config.insightTimeout());
        if (generated.isEmpty()) {
            return FallbackInsights.report(summary, config);
        }

        String exclusion = summary instanceof MlSummary ml ? FallbackInsights.exclusionNote(ml) : null;
        int room = exclusion == null ? config.maxInsights() : Math.max(1, config.maxInsights() - 1);
        InsightResponseParser.ParsedInsights parsed = InsightResponseParser.parse(generated.get(), room);
        if (!parsed.hasInsights()) {
            log.warn("Generated text contained no bullet insights; using template insights");
            return FallbackInsights.report(summary, config);
        }

        List<String> insights = new ArrayList<>(parsed.insights());
        if (exclusion != null) {
            insights.add(exclusion);
        }
        String recommendation = parsed.recommendation() != null
                ? parsed.recommendation()
                : FallbackInsights.recommendation(summary, config);
        return new InsightReport(insights, recommendation, summary.route(), InsightSource.GENERATED);
    }

    private Optional<String> requestText(String prompt, Duration timeout) {
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> textGenerationClient.generate(prompt, timeout), generationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Generation pool saturated, using template insights: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                log.warn("Text generation returned an empty answer; using template insights");
                return Optional.empty();
            }
            return Optional.of(text);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{}; using template insights", new GenerationTimeoutException(timeout).getMessage());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Text generation failed ({}); using template insights", cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for text generation; using template insights");
            return Optional.empty();
        }
    }
}
