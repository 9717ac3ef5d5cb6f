package com.dataset_analyzer.dto.response;

import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.analysis.AnalysisRun;
import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzeResponse {
    private UUID runId;
    private Route route;
    private AnalysisSummary summary;
    private List<String> insights;
    private String recommendation;
    private InsightSource insightSource;
    private boolean fallbackApplied;

    public static AnalyzeResponse from(AnalysisRun run) {
        return AnalyzeResponse.builder()
                .runId(run.getRunId())
                .route(run.getRoute())
                .summary(run.getSummary())
                .insights(run.getReport().insights())
                .recommendation(run.getReport().recommendation())
                .insightSource(run.getReport().source())
                .fallbackApplied(run.isFallbackApplied())
                .build();
    }
}
