package com.devflow.orchestrator.retrieval;

/**
 * How long to wait before retrying a strategy after a transient failure.
 * Supplied by the environment; the orchestrator only decides <em>whether</em>
 * to retry.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * Block until the retry may start.
     *
     * @param retry 1 for the first retry of this strategy within a fetch
     * @throws InterruptedException if the fetch is cancelled while waiting
     */
    void pause(RetrievalStrategy strategy, int retry) throws InterruptedException;

    /** No delay. Used in tests and by callers that handle pacing themselves. */
    static BackoffPolicy none() {
        return (strategy, retry) -> {};
    }
}
