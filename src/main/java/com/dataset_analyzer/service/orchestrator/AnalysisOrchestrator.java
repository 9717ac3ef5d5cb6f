package com.dataset_analyzer.service.orchestrator;

import com.dataset_analyzer.agent.DatasetProfiler;
import com.dataset_analyzer.agent.InsightAgent;
import com.dataset_analyzer.agent.RoutingAgent;
import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.exception.InsufficientDataException;
import com.dataset_analyzer.exception.RunCancelledException;
import com.dataset_analyzer.model.analysis.AnalysisRun;
import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.dataset_analyzer.model.analysis.InsightReport;
import com.dataset_analyzer.model.analysis.RoutingDecision;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import com.dataset_analyzer.strategy.AnalysisStrategyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs profiler, router, strategy and insight agent in sequence for one dataset.
 * <p>
 * Cancellation is honoured only between stages, through the {@link CancellationCheck} the caller
 * passes in. When the ML strategy reports insufficient data
 * the run continues on the EDA route and says so on the returned {@link AnalysisRun}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisOrchestrator {

    static final int PREVIEW_ROWS = 3;

    private final DatasetProfiler profiler;
    private final RoutingAgent routingAgent;
    private final AnalysisStrategyResolver strategyResolver;
    private final InsightAgent insightAgent;

    public AnalysisRun analyze(Dataset dataset, AnalysisConfig config, CancellationCheck cancellation) {
        return analyze(UUID.randomUUID(), dataset, config, cancellation, 0);
    }

    public AnalysisRun analyze(UUID runId, Dataset dataset, AnalysisConfig config,
                               CancellationCheck cancellation, int droppedRowCount) {
        log.info("▶ Run {} started for dataset '{}'", runId, dataset.getName());

        DatasetProfile profile = profiler.profile(dataset);
        checkpoint(runId, cancellation, "profiling");

        RoutingDecision decision = routingAgent.route(profile, config);
        checkpoint(runId, cancellation, "routing");

        Route route = decision.route();
        boolean fallbackApplied = false;
        AnalysisSummary summary;
        try {
            summary = strategyResolver.resolve(route).analyze(dataset, profile, config);
        } catch (InsufficientDataException e) {
            if (route != Route.ML) {
                throw e;
            }
            log.warn("Run {}: ML analysis not possible ({}); falling back to EDA", runId, e.getMessage());
            route = Route.EDA;
            fallbackApplied = true;
            summary = strategyResolver.resolve(route).analyze(dataset, profile, config);
        }
        checkpoint(runId, cancellation, "analysis");

        InsightReport report = insightAgent.generate(summary, profile, dataset.head(PREVIEW_ROWS), config);
        checkpoint(runId, cancellation, "insight generation");

        log.info("✅ Run {} finished: route={}, insights={} ({})", runId, route.getCode(),
                report.insights().size(), report.source().getCode());

        return AnalysisRun.builder()
                .runId(runId)
                .datasetName(dataset.getName())
                .profile(profile)
                .decision(decision)
                .route(route)
                .fallbackApplied(fallbackApplied)
                .droppedRowCount(droppedRowCount)
                .summary(summary)
                .report(report)
                .build();
    }

    private static void checkpoint(UUID runId, CancellationCheck cancellation, String completedStage) {
        if (cancellation.isCancelled()) {
            // the interrupt has been acted on; leave the worker thread clean
            Thread.interrupted();
            log.info("Run {} cancelled after {}", runId, completedStage);
            throw new RunCancelledException("Analysis run " + runId + " was cancelled after " + completedStage + ".");
        }
    }
}
