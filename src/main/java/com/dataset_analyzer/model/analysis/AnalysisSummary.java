package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.Route;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Structured result of an analysis strategy, tagged by the route that produced it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MlSummary.class, name = "ml"),
        @JsonSubTypes.Type(value = EdaSummary.class, name = "eda")
})
public sealed interface AnalysisSummary permits MlSummary, EdaSummary {

    @JsonIgnore
    Route route();

    /**
     * Flat view of the summary used to build insight prompts.
     */
    @JsonIgnore
    Map<String, Object> describe();
}
