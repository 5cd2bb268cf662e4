package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.github.GitHubApiClient;
import com.devflow.orchestrator.github.GitHubApiException;
import com.devflow.orchestrator.retrieval.RepoCoordinates;
import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;
import com.devflow.orchestrator.retrieval.SizeEstimator;
import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.devflow.orchestrator.retrieval.probe.ProbeManifest;
import com.devflow.orchestrator.retrieval.probe.ProbePolicy;
import com.devflow.orchestrator.tracker.IssueTrackerClient;
import com.devflow.orchestrator.tracker.IssueTrackerException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

/**
 * STRUCTURED_API probe: the authenticated GitHub REST API, plus the issue
 * tracker's REST API for {@link ResourceType#TICKET}.
 *
 * Cheapest strategy and the one with the smallest ceiling. For change-set
 * resources the PR metadata is read first and the response size estimated
 * from its counters, so an oversized PR is reported without downloading it.
 */
@Component
public class StructuredApiProbe implements CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(StructuredApiProbe.class);

    private static final RetrievalStrategy STRATEGY = RetrievalStrategy.STRUCTURED_API;

    private static final ProbeManifest MANIFEST = new ProbeManifest(
            "github_rest", "1.0.0", STRATEGY,
            "Authenticated GitHub REST API (and tracker REST API for tickets); structured JSON.",
            EnumSet.allOf(ResourceType.class));

    private final GitHubApiClient    github;
    private final IssueTrackerClient tracker;
    private final ProbePolicy        policy;

    public StructuredApiProbe(GitHubApiClient github,
                              IssueTrackerClient tracker,
                              @Value("${devflow.retrieval.structured-api.capacity-ceiling:25000}") long ceiling) {
        this.github  = github;
        this.tracker = tracker;
        this.policy  = ProbePolicy.ofCeiling(ceiling);
    }

    @Override public ProbeManifest manifest() { return MANIFEST; }
    @Override public ProbePolicy   policy()   { return policy; }

    /** Tickets are only offered when a tracker is configured. */
    @Override
    public boolean supports(RetrievalRequest request) {
        if (request.resource() == ResourceType.TICKET) {
            return tracker.isConfigured();
        }
        return CapabilityProbe.super.supports(request);
    }

    @Override
    public RetrievalOutcome invoke(RetrievalRequest request) {
        if (request.resource() == ResourceType.TICKET) {
            return fetchTicket(request.key());
        }

        RepoCoordinates repo = request.repo();
        String pull = "/repos/%s/%s/pulls/%d".formatted(repo.owner(), repo.repo(), repo.number());
        long estimate = 0;
        try {
            if (!request.resource().changeSetSized()) {
                String path = request.resource() == ResourceType.ISSUE
                        ? "/repos/%s/%s/issues/%d".formatted(repo.owner(), repo.repo(), repo.number())
                        : pull;
                return measured(github.getJson(path).toString());
            }

            JsonNode meta = github.getJson(pull);
            estimate = SizeEstimator.estimateChangeSet(request.resource(),
                    meta.path("changed_files").asLong(),
                    meta.path("additions").asLong(),
                    meta.path("deletions").asLong(),
                    meta.path("commits").asLong());
            if (!policy.admits(estimate)) {
                log.info("{} estimated at ~{} tokens from PR metadata; over ceiling {}",
                        request, estimate, policy.capacityCeiling());
                return new RetrievalOutcome.SizeExceeded(STRATEGY, estimate);
            }

            String payload = switch (request.resource()) {
                case PR_FILES       -> github.getAllPages(pull + "/files").toString();
                case PR_DIFF        -> github.getDiff(pull);
                case COMMIT_HISTORY -> github.getAllPages(pull + "/commits").toString();
                default -> throw new IllegalStateException("Unhandled resource " + request.resource());
            };
            return measured(payload);

        } catch (GitHubApiException e) {
            log.debug("GitHub call for {} failed: {}", request, e.getMessage());
            return GitHubFailures.toOutcome(STRATEGY, e, policy.capacityCeiling(), estimate);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RetrievalOutcome fetchTicket(String key) {
        try {
            return measured(tracker.getIssue(key).toString());
        } catch (IssueTrackerException e) {
            return switch (e.statusCode()) {
                case 401, 403, 404 -> new RetrievalOutcome.PermissionDenied(STRATEGY,
                        "issue tracker answered HTTP " + e.statusCode());
                default -> new RetrievalOutcome.TransientFailure(STRATEGY, e.getMessage());
            };
        }
    }

    /** Success if the downloaded payload fits under the ceiling, SizeExceeded otherwise. */
    private RetrievalOutcome measured(String payload) {
        long tokens = SizeEstimator.tokens(payload);
        if (!policy.admits(tokens)) {
            return new RetrievalOutcome.SizeExceeded(STRATEGY, tokens);
        }
        return new RetrievalOutcome.Success(STRATEGY, payload, tokens);
    }
}
