package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.github.GitHubApiException;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;
import com.devflow.orchestrator.retrieval.SizeEstimator;

/**
 * Maps GitHub API failures to retrieval outcomes.
 *
 * Only transport errors, rate limits and 5xx are worth a retry. 404 counts
 * as a permission problem because GitHub answers 404 for private
 * repositories the token cannot see. Any other 4xx (400, 410, a 422 that is
 * not about size) is a rejection the same request would get again, so it
 * ends the fetch as well.
 */
final class GitHubFailures {

    private GitHubFailures() {}

    /**
     * @param ceiling      capacity ceiling of the probe that made the call
     * @param knownEstimate best size estimate the probe already had, or 0
     */
    static RetrievalOutcome toOutcome(RetrievalStrategy strategy, GitHubApiException e,
                                      long ceiling, long knownEstimate) {
        if (e.isTransport()) {
            return new RetrievalOutcome.TransientFailure(strategy, e.getMessage());
        }
        if (e.isRateLimited()) {
            return new RetrievalOutcome.TransientFailure(strategy, "rate limited: HTTP " + e.statusCode());
        }
        if (e.isTooLarge()) {
            return new RetrievalOutcome.SizeExceeded(strategy,
                    Math.max(knownEstimate, SizeEstimator.beyond(ceiling)));
        }
        int status = e.statusCode();
        if (status == 401 || status == 403 || status == 404) {
            return new RetrievalOutcome.PermissionDenied(strategy, "GitHub answered HTTP " + status);
        }
        if (status >= 400 && status < 500) {
            return new RetrievalOutcome.PermissionDenied(strategy,
                    "GitHub rejected the request: HTTP " + status);
        }
        return new RetrievalOutcome.TransientFailure(strategy, e.getMessage());
    }
}
