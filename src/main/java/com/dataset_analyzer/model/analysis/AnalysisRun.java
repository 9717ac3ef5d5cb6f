package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.UUID;

/**
 * Everything one request produced. {@link #getRoute()} is the route whose strategy
 * actually ran; it differs from the routing decision only when {@code fallbackApplied} is set.
 */
@Getter
@Builder
public class AnalysisRun {

    @NonNull
    private final UUID runId;

    private final String datasetName;

    @NonNull
    private final DatasetProfile profile;

    @NonNull
    private final RoutingDecision decision;

    @NonNull
    private final Route route;

    private final boolean fallbackApplied;

    private final int droppedRowCount;

    @NonNull
    private final AnalysisSummary summary;

    @NonNull
    private final InsightReport report;
}
