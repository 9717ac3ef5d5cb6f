package com.dataset_analyzer.service.orchestrator;

/**
 * The hook for stopping a run: polled by the orchestrator between pipeline stages.
 * Nothing cancels a run on its own. The HTTP layer does not interrupt request threads when a
 * client disconnects, so a caller that wants early termination must supply its own check.
 */
@FunctionalInterface
public interface CancellationCheck {

    CancellationCheck NEVER = () -> false;

    boolean isCancelled();

    /**
     * Cancelled when the calling thread has been interrupted. The orchestrator clears the
     * interrupt once it stops the run.
     */
    static CancellationCheck currentThread() {
        Thread caller = Thread.currentThread();
        return caller::isInterrupted;
    }
}
