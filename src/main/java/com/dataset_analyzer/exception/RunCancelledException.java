package com.dataset_analyzer.exception;

public class RunCancelledException extends RuntimeException {

    public RunCancelledException() {
        super("Analysis run was cancelled.");
    }

    public RunCancelledException(String message) {
        super(message);
    }
}
