package com.devflow.orchestrator.retrieval;

/**
 * How a {@link QueryOrchestrator#fetch} call ended.
 *
 *   SUCCEEDED  a probe returned Success
 *   ABORTED    a probe returned PermissionDenied; nothing else was tried
 *   EXHAUSTED  pruning, demotion or the size hint left no strategy to try,
 *              or the attempt limit was reached
 */
public enum FetchState {
    SUCCEEDED,
    ABORTED,
    EXHAUSTED
}
