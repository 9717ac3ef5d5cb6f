package com.dataset_analyzer.agent;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.analysis.RoutingDecision;
import com.dataset_analyzer.model.dataset.DatasetProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the ML route for large, mostly numeric datasets and EDA for everything else.
 * Both comparisons are strict.
 */
@Slf4j
@Component
public class RoutingAgent {

    public RoutingDecision route(DatasetProfile profile, AnalysisConfig config) {
        boolean enoughRows = profile.rowCount() > config.mlMinRows();
        boolean mostlyNumeric = profile.numericColumnRatio() > config.mlMinNumericRatio();
        Route route = enoughRows && mostlyNumeric ? Route.ML : Route.EDA;

        log.info("Routing to {} (rows={} > {}: {}, numeric ratio={} > {}: {})",
                route, profile.rowCount(), config.mlMinRows(), enoughRows,
                String.format("%.2f", profile.numericColumnRatio()), config.mlMinNumericRatio(), mostlyNumeric);
        return new RoutingDecision(route, profile);
    }
}
