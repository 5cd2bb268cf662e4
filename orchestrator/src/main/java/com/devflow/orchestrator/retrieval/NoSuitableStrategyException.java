package com.devflow.orchestrator.retrieval;

/**
 * No registered probe can serve the requested resource type at all.
 * A configuration problem rather than a retrieval outcome.
 */
public class NoSuitableStrategyException extends RuntimeException {
    public NoSuitableStrategyException(RetrievalRequest request) {
        super("No retrieval strategy supports " + request.resource() + " (key " + request.key() + ")");
    }
}
