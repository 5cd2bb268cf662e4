package com.devflow.orchestrator.retrieval;

/**
 * Tagged result of one probe invocation, and of a whole fetch.
 *
 * The tag says what went wrong, not what to do about it; the retry policy
 * lives in {@link QueryOrchestrator}.
 */
public sealed interface RetrievalOutcome {

    enum Kind { SUCCESS, SIZE_EXCEEDED, TRANSIENT_FAILURE, PERMISSION_DENIED }

    /**
     * Strategy that produced this outcome. Null only for a
     * {@link SizeExceeded} raised before any probe ran.
     */
    RetrievalStrategy strategy();

    Kind kind();

    default boolean isSuccess() {
        return kind() == Kind.SUCCESS;
    }

    /** @param estimatedSize size of {@code payload} in approximate tokens */
    record Success(RetrievalStrategy strategy, String payload, long estimatedSize)
            implements RetrievalOutcome {
        @Override public Kind kind() { return Kind.SUCCESS; }
    }

    /** @param estimatedSize best known size of the full response, in approximate tokens */
    record SizeExceeded(RetrievalStrategy strategy, long estimatedSize)
            implements RetrievalOutcome {
        @Override public Kind kind() { return Kind.SIZE_EXCEEDED; }
    }

    record TransientFailure(RetrievalStrategy strategy, String cause)
            implements RetrievalOutcome {
        @Override public Kind kind() { return Kind.TRANSIENT_FAILURE; }
    }

    record PermissionDenied(RetrievalStrategy strategy, String reason)
            implements RetrievalOutcome {
        @Override public Kind kind() { return Kind.PERMISSION_DENIED; }
    }
}
