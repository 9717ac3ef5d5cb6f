package com.dataset_analyzer.model.dataset;

import java.util.Optional;

public final class NullValue implements CellValue {

    public static final NullValue INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public boolean isMissing() {
        return true;
    }

    @Override
    public Optional<Double> asNumber() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "null";
    }
}
