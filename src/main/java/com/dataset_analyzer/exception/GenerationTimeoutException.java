package com.dataset_analyzer.exception;

import java.time.Duration;

public class GenerationTimeoutException extends GenerationFailureException {

    public GenerationTimeoutException(Duration timeout) {
        super("Text generation did not answer within " + timeout.toMillis() + " ms");
    }

    public GenerationTimeoutException(Duration timeout, Throwable cause) {
        super("Text generation did not answer within " + timeout.toMillis() + " ms", cause);
    }
}
