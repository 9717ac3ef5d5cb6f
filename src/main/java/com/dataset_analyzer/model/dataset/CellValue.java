package com.dataset_analyzer.model.dataset;

import java.util.Optional;

/**
 * A single scalar cell of a {@link Dataset}.
 * Inbound JSON values are converted once into one of the four variants so the
 * pipeline stages never coerce raw objects themselves.
 */
public sealed interface CellValue permits NumberValue, TextValue, BoolValue, NullValue {

    /**
     * Null values and blank text both count as missing.
     */
    boolean isMissing();

    /**
     * The numeric reading of this cell, if it has one. Text is parsed; booleans never are.
     */
    Optional<Double> asNumber();

    static CellValue of(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof CellValue cell) {
            return cell;
        }
        if (raw instanceof Number number) {
            return new NumberValue(number.doubleValue());
        }
        if (raw instanceof Boolean bool) {
            return new BoolValue(bool);
        }
        return new TextValue(raw.toString());
    }
}
