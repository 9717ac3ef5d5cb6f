package com.dataset_analyzer.strategy;

import com.dataset_analyzer.enumeration.Route;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link AnalysisStrategy} that implements a {@link Route}.
 */
@Component
@RequiredArgsConstructor
public class AnalysisStrategyResolver {

    private final MlAnalysisStrategy mlStrategy;
    private final EdaAnalysisStrategy edaStrategy;

    public AnalysisStrategy resolve(Route route) {
        return switch (route) {
            case ML -> mlStrategy;
            case EDA -> edaStrategy;
        };
    }
}
