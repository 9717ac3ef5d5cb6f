package com.dataset_analyzer.model.analysis;

import com.dataset_analyzer.enumeration.Route;
import com.dataset_analyzer.model.dataset.DatasetProfile;

import java.util.Objects;

/**
 * Route chosen by the routing agent, together with the profile it was chosen from.
 */
public record RoutingDecision(Route route, DatasetProfile profile) {

    public RoutingDecision {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(profile, "profile");
    }
}
