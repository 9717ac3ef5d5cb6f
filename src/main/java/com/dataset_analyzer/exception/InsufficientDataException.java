package com.dataset_analyzer.exception;

/**
 * Not enough complete numeric rows for the ML strategy. The orchestrator recovers by running EDA.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
