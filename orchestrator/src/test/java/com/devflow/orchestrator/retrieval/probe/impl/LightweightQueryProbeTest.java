package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.cli.CommandException;
import com.devflow.orchestrator.cli.CommandResult;
import com.devflow.orchestrator.cli.CommandRunner;
import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LightweightQueryProbe.
 * The gh process is replaced by a mocked CommandRunner.
 */
@ExtendWith(MockitoExtension.class)
class LightweightQueryProbeTest {

    static final RetrievalRequest DIFF = RetrievalRequest.of(ResourceType.PR_DIFF, "octo/widgets#42");

    @Mock CommandRunner runner;

    LightweightQueryProbe probe;

    @BeforeEach
    void setUp() {
        probe = new LightweightQueryProbe(runner, "gh", 30, 200_000);
    }

    // ------------------------------------------------------------------
    // Command lines
    // ------------------------------------------------------------------

    @Test
    void command_perResource() {
        assertThat(probe.command(DIFF))
                .containsExactly("gh", "pr", "diff", "42", "--repo", "octo/widgets");
        assertThat(probe.command(RetrievalRequest.of(ResourceType.PR_FILES, "octo/widgets#42")))
                .containsExactly("gh", "pr", "view", "42", "--repo", "octo/widgets", "--json", "files");
        assertThat(probe.command(RetrievalRequest.of(ResourceType.COMMIT_HISTORY, "octo/widgets#42")))
                .containsExactly("gh", "pr", "view", "42", "--repo", "octo/widgets", "--json", "commits");
        assertThat(probe.command(RetrievalRequest.of(ResourceType.ISSUE, "octo/widgets#7")))
                .startsWith("gh", "issue", "view", "7")
                .contains(LightweightQueryProbe.ISSUE_FIELDS);
        assertThat(probe.command(RetrievalRequest.of(ResourceType.PR_METADATA, "octo/widgets#42")))
                .contains(LightweightQueryProbe.PR_FIELDS);
    }

    @Test
    void tickets_notSupported() {
        assertThat(probe.supports(RetrievalRequest.of(ResourceType.TICKET, "OPS-7"))).isFalse();
        assertThat(probe.supports(DIFF)).isTrue();
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    @Test
    void exitZero_success() {
        when(runner.run(anyList(), eq(Duration.ofSeconds(30))))
                .thenReturn(new CommandResult(0, "diff --git a/A b/A\n", "", 0.4, false));

        assertThat(probe.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.Success.class,
                s -> assertThat(s.payload()).startsWith("diff --git"));
    }

    @Test
    void outputOverCeiling_sizeExceeded() {
        LightweightQueryProbe small = new LightweightQueryProbe(runner, "gh", 30, 10);
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(0, "x".repeat(400), "", 0.4, false));

        assertThat(small.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.SizeExceeded.class,
                s -> assertThat(s.estimatedSize()).isEqualTo(100));
    }

    @Test
    void diffTooLarge_sizeExceededBeyondCeiling() {
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(1, "",
                "could not find pull request diff: HTTP 406: Sorry, the diff exceeded the maximum number of files (300)",
                1.0, false));

        assertThat(probe.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.SizeExceeded.class,
                s -> assertThat(s.estimatedSize()).isEqualTo(200_001));
    }

    @Test
    void authFailure_permissionDenied() {
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(4, "",
                "To get started with GitHub CLI, please run:  gh auth login\n", 0.1, false));

        assertThat(probe.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.PermissionDenied.class,
                d -> assertThat(d.reason()).contains("gh auth login"));
    }

    @Test
    void unknownRepository_permissionDenied() {
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(1, "",
                "GraphQL: Could not resolve to a Repository with the name 'octo/widgets'. (repository)",
                0.3, false));

        assertThat(probe.invoke(DIFF)).isInstanceOf(RetrievalOutcome.PermissionDenied.class);
    }

    @Test
    void timeout_transientFailure() {
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(-1, "", "", 30.0, true));

        assertThat(probe.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.TransientFailure.class,
                t -> assertThat(t.cause()).contains("timed out"));
    }

    @Test
    void otherNonZeroExit_transientFailure() {
        when(runner.run(anyList(), any())).thenReturn(new CommandResult(1, "",
                "\nerror connecting to api.github.com\n", 5.0, false));

        assertThat(probe.invoke(DIFF)).isInstanceOfSatisfying(RetrievalOutcome.TransientFailure.class,
                t -> assertThat(t.cause()).isEqualTo("gh exited 1: error connecting to api.github.com"));
    }

    @Test
    void ghMissing_transientFailure() {
        when(runner.run(List.of("gh", "pr", "diff", "42", "--repo", "octo/widgets"), Duration.ofSeconds(30)))
                .thenThrow(new CommandException("Could not start 'gh'"));

        assertThat(probe.invoke(DIFF)).isInstanceOf(RetrievalOutcome.TransientFailure.class);
    }
}
