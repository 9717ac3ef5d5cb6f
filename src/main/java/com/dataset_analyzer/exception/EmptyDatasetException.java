package com.dataset_analyzer.exception;

/**
 * The dataset has no rows or no columns. Fatal to the run.
 */
public class EmptyDatasetException extends RuntimeException {

    public EmptyDatasetException() {
        super("Dataset must contain at least one row and one column.");
    }

    public EmptyDatasetException(String message) {
        super(message);
    }
}
