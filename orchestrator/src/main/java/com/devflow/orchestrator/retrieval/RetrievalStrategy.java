package com.devflow.orchestrator.retrieval;

/**
 * The ways a piece of repository or tracker data can be retrieved.
 *
 * Declared in ascending cost order; the orchestrator relies on the natural
 * enum order when it ranks strategies, so new constants must be inserted
 * at the position matching their cost.
 */
public enum RetrievalStrategy {
    STRUCTURED_API,     // authenticated REST API, structured JSON
    LIGHTWEIGHT_QUERY,  // local CLI invocation
    DELEGATED_ANALYSIS  // sub-task that reads the raw data and returns a digest
}
