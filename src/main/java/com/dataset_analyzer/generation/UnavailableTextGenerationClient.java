package com.dataset_analyzer.generation;

import com.dataset_analyzer.exception.GenerationFailureException;

import java.time.Duration;

/**
 * Wired when no generation service is configured. Every call fails, so reports use the template fallback.
 */
public class UnavailableTextGenerationClient implements TextGenerationClient {

    private final String reason;

    public UnavailableTextGenerationClient(String reason) {
        this.reason = reason;
    }

    @Override
    public String generate(String prompt, Duration timeout) {
        throw new GenerationFailureException("Text generation unavailable: " + reason);
    }
}
