package com.dataset_analyzer.model.dataset;

import java.util.Optional;

public record BoolValue(boolean value) implements CellValue {

    @Override
    public boolean isMissing() {
        return false;
    }

    @Override
    public Optional<Double> asNumber() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
