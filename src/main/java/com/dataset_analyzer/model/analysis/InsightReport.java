package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.InsightSource;
import com.dataset_analyzer.enumeration.Route;

import java.util.List;

public record InsightReport(List<String> insights, String recommendation, Route route, InsightSource source) {

    public InsightReport {
        insights = List.copyOf(insights);
    }
}
