package com.devflow.orchestrator.retrieval;

import java.util.List;

/**
 * Final outcome of a fetch together with the attempts that led to it.
 *
 * @param finalState one of the terminal {@link FetchState}s
 * @param attempts   probe invocations in the order they were made
 */
public record FetchReport(
        RetrievalRequest   request,
        RetrievalOutcome   outcome,
        FetchState         finalState,
        List<ProbeAttempt> attempts) {

    public FetchReport {
        attempts = List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    /** Strategies in attempt order, repeats included. */
    public List<RetrievalStrategy> attemptedStrategies() {
        return attempts.stream().map(ProbeAttempt::strategy).toList();
    }
}
