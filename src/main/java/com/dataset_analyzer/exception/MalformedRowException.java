package com.dataset_analyzer.exception;

import lombok.Getter;

import java.util.Set;

/**
 * An inbound row whose columns disagree with the majority schema.
 */
@Getter
public class MalformedRowException extends RuntimeException {

    private final int rowIndex;

    public MalformedRowException(int rowIndex, Set<String> expectedColumns, Set<String> actualColumns) {
        super("Row " + rowIndex + " has columns " + actualColumns + " but the dataset schema is " + expectedColumns);
        this.rowIndex = rowIndex;
    }
}
