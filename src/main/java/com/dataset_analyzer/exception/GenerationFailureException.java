package com.dataset_analyzer.exception;

/**
 * The text-generation service could not produce an answer.
 */
public class GenerationFailureException extends RuntimeException {

    public GenerationFailureException(String message) {
        super(message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
