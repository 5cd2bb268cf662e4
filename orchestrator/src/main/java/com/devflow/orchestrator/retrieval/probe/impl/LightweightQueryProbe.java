package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.cli.CommandException;
import com.devflow.orchestrator.cli.CommandResult;
import com.devflow.orchestrator.cli.CommandRunner;
import com.devflow.orchestrator.retrieval.RepoCoordinates;
import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;
import com.devflow.orchestrator.retrieval.SizeEstimator;
import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.devflow.orchestrator.retrieval.probe.ProbeManifest;
import com.devflow.orchestrator.retrieval.probe.ProbePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * LIGHTWEIGHT_QUERY probe: the GitHub CLI ({@code gh}) run as a local process.
 *
 * Uses whatever credentials {@code gh auth} already holds. Output goes
 * through the same size check as the API probe; failures are classified
 * from the CLI's stderr.
 */
@Component
public class LightweightQueryProbe implements CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(LightweightQueryProbe.class);

    private static final RetrievalStrategy STRATEGY = RetrievalStrategy.LIGHTWEIGHT_QUERY;

    private static final ProbeManifest MANIFEST = new ProbeManifest(
            "gh_cli", "1.0.0", STRATEGY,
            "Local GitHub CLI query (gh pr view / gh pr diff / gh issue view).",
            EnumSet.of(ResourceType.PR_METADATA, ResourceType.PR_FILES, ResourceType.PR_DIFF,
                       ResourceType.COMMIT_HISTORY, ResourceType.ISSUE));

    static final String PR_FIELDS =
            "number,title,state,author,baseRefName,headRefName,additions,deletions,changedFiles,url";
    static final String ISSUE_FIELDS = "number,title,state,author,body,labels,url";

    private static final Pattern DENIED = Pattern.compile(
            "http 401|http 403|http 404|gh auth login|authentication|could not resolve to a");
    private static final Pattern TOO_LARGE = Pattern.compile(
            "http 406|too_large|too large|diff exceeded");

    private final CommandRunner runner;
    private final String        ghExecutable;
    private final Duration      commandTimeout;
    private final ProbePolicy   policy;

    public LightweightQueryProbe(
            CommandRunner runner,
            @Value("${devflow.retrieval.lightweight-query.gh-executable:gh}") String ghExecutable,
            @Value("${devflow.retrieval.lightweight-query.command-timeout-sec:60}") int commandTimeoutSec,
            @Value("${devflow.retrieval.lightweight-query.capacity-ceiling:200000}") long ceiling) {
        this.runner         = runner;
        this.ghExecutable   = ghExecutable;
        this.commandTimeout = Duration.ofSeconds(commandTimeoutSec);
        this.policy         = ProbePolicy.ofCeiling(ceiling);
    }

    @Override public ProbeManifest manifest() { return MANIFEST; }
    @Override public ProbePolicy   policy()   { return policy; }

    @Override
    public RetrievalOutcome invoke(RetrievalRequest request) {
        List<String> command = command(request);

        CommandResult result;
        try {
            result = runner.run(command, commandTimeout);
        } catch (CommandException e) {
            return new RetrievalOutcome.TransientFailure(STRATEGY, e.getMessage());
        }

        if (result.timedOut()) {
            return new RetrievalOutcome.TransientFailure(STRATEGY,
                    "gh timed out after " + commandTimeout.toSeconds() + " s");
        }
        if (result.success()) {
            long tokens = SizeEstimator.tokens(result.stdout());
            if (!policy.admits(tokens)) {
                return new RetrievalOutcome.SizeExceeded(STRATEGY, tokens);
            }
            return new RetrievalOutcome.Success(STRATEGY, result.stdout(), tokens);
        }

        String stderr = result.stderr() == null ? "" : result.stderr().toLowerCase(Locale.ROOT);
        log.debug("gh exited {} for {}: {}", result.exitCode(), request, result.firstErrorLine());
        if (DENIED.matcher(stderr).find()) {
            return new RetrievalOutcome.PermissionDenied(STRATEGY, result.firstErrorLine());
        }
        if (TOO_LARGE.matcher(stderr).find()) {
            long hint = request.hasSizeHint() ? request.sizeHint() : 0;
            long estimate = policy.isUnbounded()
                    ? Math.max(hint, SizeEstimator.tokens(result.stdout()))
                    : Math.max(hint, SizeEstimator.beyond(policy.capacityCeiling()));
            return new RetrievalOutcome.SizeExceeded(STRATEGY, estimate);
        }
        return new RetrievalOutcome.TransientFailure(STRATEGY,
                "gh exited " + result.exitCode() + ": " + result.firstErrorLine());
    }

    /** The gh command line for a request. */
    List<String> command(RetrievalRequest request) {
        RepoCoordinates repo = request.repo();
        String n    = String.valueOf(repo.number());
        String slug = repo.slug();
        return switch (request.resource()) {
            case PR_METADATA    -> List.of(ghExecutable, "pr", "view", n, "--repo", slug, "--json", PR_FIELDS);
            case PR_FILES       -> List.of(ghExecutable, "pr", "view", n, "--repo", slug, "--json", "files");
            case PR_DIFF        -> List.of(ghExecutable, "pr", "diff", n, "--repo", slug);
            case COMMIT_HISTORY -> List.of(ghExecutable, "pr", "view", n, "--repo", slug, "--json", "commits");
            case ISSUE          -> List.of(ghExecutable, "issue", "view", n, "--repo", slug, "--json", ISSUE_FIELDS);
            case TICKET -> throw new IllegalArgumentException("gh cannot query tracker tickets");
        };
    }
}
