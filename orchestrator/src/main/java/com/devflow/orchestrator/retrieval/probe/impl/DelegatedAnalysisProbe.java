package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.claude.ClaudeClient;
import com.devflow.orchestrator.claude.ClaudeClient.ClaudeApiException;
import com.devflow.orchestrator.claude.ClaudeClient.Message;
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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * DELEGATED_ANALYSIS probe: hands the raw change-set to a sub-task and
 * returns its digest instead of the data itself.
 *
 * The raw list (files with patches, or commits) is downloaded page by page,
 * split into chunks of at most {@code chunk-tokens}, and each chunk is
 * condensed by the model. Because only digests come back, the response
 * stays small no matter how large the PR is; the practical limit is the
 * number of chunks.
 */
@Component
public class DelegatedAnalysisProbe implements CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(DelegatedAnalysisProbe.class);

    private static final RetrievalStrategy STRATEGY = RetrievalStrategy.DELEGATED_ANALYSIS;

    private static final ProbeManifest MANIFEST = new ProbeManifest(
            "subtask_digest", "1.0.0", STRATEGY,
            "Sub-task reads the full change-set in chunks and returns a condensed digest.",
            EnumSet.of(ResourceType.PR_FILES, ResourceType.PR_DIFF, ResourceType.COMMIT_HISTORY));

    private static final int DIGEST_MAX_TOKENS = 2048;

    private final GitHubApiClient github;
    private final ClaudeClient    claude;
    private final String          model;
    private final long            chunkTokens;
    private final int             maxChunks;
    private final ProbePolicy     policy;

    public DelegatedAnalysisProbe(
            GitHubApiClient github,
            ClaudeClient claude,
            @Value("${devflow.delegation.model:claude-sonnet-4-6}") String model,
            @Value("${devflow.retrieval.delegated-analysis.chunk-tokens:20000}") long chunkTokens,
            @Value("${devflow.retrieval.delegated-analysis.max-chunks:40}") int maxChunks,
            @Value("${devflow.retrieval.delegated-analysis.capacity-ceiling:0}") long ceiling) {
        this.github      = github;
        this.claude      = claude;
        this.model       = model;
        this.chunkTokens = chunkTokens;
        this.maxChunks   = maxChunks;
        this.policy      = ProbePolicy.ofCeiling(ceiling);
    }

    @Override public ProbeManifest manifest() { return MANIFEST; }
    @Override public ProbePolicy   policy()   { return policy; }

    @Override
    public RetrievalOutcome invoke(RetrievalRequest request) {
        RepoCoordinates repo = request.repo();
        String pull = "/repos/%s/%s/pulls/%d".formatted(repo.owner(), repo.repo(), repo.number());
        String listPath = request.resource() == ResourceType.COMMIT_HISTORY
                ? pull + "/commits"
                : pull + "/files";   // PR_DIFF is rebuilt from per-file patches

        ArrayNode items;
        try {
            items = github.getAllPages(listPath);
        } catch (GitHubApiException e) {
            return GitHubFailures.toOutcome(STRATEGY, e, policy.capacityCeiling(), 0);
        }

        List<String> chunks = chunk(items, chunkTokens);
        long rawTokens = chunks.stream().mapToLong(SizeEstimator::tokens).sum();
        if (chunks.size() > maxChunks || !policy.admits(rawTokens)) {
            log.info("{} needs {} chunks (~{} tokens); limit is {} chunks",
                    request, chunks.size(), rawTokens, maxChunks);
            return new RetrievalOutcome.SizeExceeded(STRATEGY, rawTokens);
        }

        String system = DigestPrompts.forResource(request.resource());
        StringBuilder digest = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                return new RetrievalOutcome.TransientFailure(STRATEGY, "interrupted after " + i + " chunks");
            }
            String header = "%s %s, part %d of %d:%n%n".formatted(
                    request.resource(), repo, i + 1, chunks.size());
            String part;
            try {
                part = claude.complete(model, system,
                        List.of(new Message("user", header + chunks.get(i))), DIGEST_MAX_TOKENS);
            } catch (ClaudeApiException e) {
                return fromModelFailure(e);
            } catch (RuntimeException e) {
                return new RetrievalOutcome.TransientFailure(STRATEGY, e.getMessage());
            }
            if (chunks.size() > 1) {
                digest.append("## Part ").append(i + 1).append('/').append(chunks.size()).append('\n');
            }
            digest.append(part.strip()).append("\n\n");
        }

        String payload = digest.toString().strip();
        log.info("Delegated digest for {}: {} items, {} chunks, ~{} → ~{} tokens",
                request, items.size(), chunks.size(), rawTokens, SizeEstimator.tokens(payload));
        return new RetrievalOutcome.Success(STRATEGY, payload, SizeEstimator.tokens(payload));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Group array elements into JSON arrays of at most {@code budget} tokens.
     * An element larger than the budget gets a chunk of its own.
     */
    static List<String> chunk(ArrayNode items, long budget) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (JsonNode item : items) {
            String text = item.toString();
            boolean empty = current.length() == 0;
            if (!empty && SizeEstimator.tokens(current + "," + text + "]") > budget) {
                chunks.add(current.append(']').toString());
                current.setLength(0);
                empty = true;
            }
            current.append(empty ? "[" : ",").append(text);
        }
        if (current.length() > 0) {
            chunks.add(current.append(']').toString());
        }
        return chunks;
    }

    private static RetrievalOutcome fromModelFailure(ClaudeApiException e) {
        return switch (e.statusCode()) {
            case 401, 403 -> new RetrievalOutcome.PermissionDenied(STRATEGY,
                    "model API answered HTTP " + e.statusCode());
            default -> new RetrievalOutcome.TransientFailure(STRATEGY, e.getMessage());
        };
    }
}
