package com.dataset_analyzer.model.dataset;

import java.util.Objects;
import java.util.Optional;

public record TextValue(String value) implements CellValue {

    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isMissing() {
        return value.isBlank();
    }

    @Override
    public Optional<Double> asNumber() {
        if (isMissing()) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isBooleanLiteral() {
        String trimmed = value.trim();
        return trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false");
    }

    @Override
    public String toString() {
        return value;
    }
}
