package com.dataset_analyzer.generation;

import com.dataset_analyzer.exception.GenerationFailureException;
import com.dataset_analyzer.exception.GenerationTimeoutException;

import java.time.Duration;

/**
 * Synchronous text-completion capability used by the insight agent.
 */
public interface TextGenerationClient {

    /**
     * @param prompt  the full user prompt
     * @param timeout upper bound for the remote call
     * @return the generated text, never {@code null}
     * @throws GenerationTimeoutException when no answer arrives within {@code timeout}
     * @throws GenerationFailureException for every other failure
     */
    String generate(String prompt, Duration timeout);
}
