package com.devflow.orchestrator.retrieval;

/**
 * What a {@link RetrievalRequest} asks for.
 *
 * All types except {@link #TICKET} are keyed by {@code owner/repo#number};
 * tickets are keyed by their tracker key, e.g. {@code TITAN-149}.
 */
public enum ResourceType {
    PR_METADATA,
    PR_FILES,
    PR_DIFF,
    COMMIT_HISTORY,   // commits of one change-set
    ISSUE,            // code-host issue
    TICKET;           // issue-tracker work item

    public boolean repoScoped() {
        return this != TICKET;
    }

    /** True for the resources whose size grows with the change-set. */
    public boolean changeSetSized() {
        return this == PR_FILES || this == PR_DIFF || this == COMMIT_HISTORY;
    }
}
