package com.dataset_analyzer.strategy;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.analysis.AnalysisSummary;
import com.dataset_analyzer.model.dataset.Dataset;
import com.dataset_analyzer.model.dataset.DatasetProfile;

/**
 * One way of analysing a profiled dataset. Implementations are stateless; everything a
 * run needs arrives through the arguments.
 */
public interface AnalysisStrategy {

    Route route();

    /**
     * @param dataset the run's dataset, already accepted by the profiler
     * @param profile the profile of {@code dataset}
     * @param config  the run's configuration
     */
    AnalysisSummary analyze(Dataset dataset, DatasetProfile profile, AnalysisConfig config);
}
