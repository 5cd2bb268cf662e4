package com.devflow.orchestrator.retrieval;

/**
 * Approximate token arithmetic shared by the probes and the orchestrator.
 *
 * One token is taken as four characters. Change-set estimates are made from
 * PR metadata before anything large is downloaded.
 */
public final class SizeEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    // Rough per-item costs observed for GitHub JSON and unified diff output.
    static final int TOKENS_PER_CHANGED_LINE = 12;
    static final int TOKENS_PER_FILE_HEADER  = 40;
    static final int TOKENS_PER_FILE_ENTRY   = 120;
    static final int TOKENS_PER_COMMIT       = 300;

    private SizeEstimator() {}

    /** Tokens needed for {@code text}; 0 for null. */
    public static long tokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Expected response size for a change-set resource, from the counters
     * a PR metadata lookup returns. Non change-set resources estimate to 0.
     */
    public static long estimateChangeSet(ResourceType resource,
                                         long changedFiles, long additions,
                                         long deletions, long commits) {
        long lines = Math.max(0, additions) + Math.max(0, deletions);
        long files = Math.max(0, changedFiles);
        return switch (resource) {
            case PR_DIFF        -> lines * TOKENS_PER_CHANGED_LINE + files * TOKENS_PER_FILE_HEADER;
            case PR_FILES       -> lines * TOKENS_PER_CHANGED_LINE + files * TOKENS_PER_FILE_ENTRY;
            case COMMIT_HISTORY -> Math.max(0, commits) * TOKENS_PER_COMMIT;
            case PR_METADATA, ISSUE, TICKET -> 0;
        };
    }

    /** The smallest size a strategy with this ceiling cannot hold. */
    public static long beyond(long ceiling) {
        return ceiling == Long.MAX_VALUE ? Long.MAX_VALUE : ceiling + 1;
    }
}
