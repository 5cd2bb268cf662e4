package com.devflow.orchestrator.retrieval;

/**
 * The thread running a fetch was interrupted. The in-flight probe call has
 * been cancelled and the interrupt flag is set again before this is thrown.
 */
public class RetrievalCancelledException extends RuntimeException {
    public RetrievalCancelledException(RetrievalRequest request, Throwable cause) {
        super("Fetch cancelled: " + request, cause);
    }
}
