package com.dataset_analyzer.model.dataset;

import java.util.Optional;

public record NumberValue(double value) implements CellValue {

    @Override
    public boolean isMissing() {
        return Double.isNaN(value);
    }

    @Override
    public Optional<Double> asNumber() {
        return isMissing() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
