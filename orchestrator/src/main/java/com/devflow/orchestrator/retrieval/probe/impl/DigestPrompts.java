package com.devflow.orchestrator.retrieval.probe.impl;

import com.devflow.orchestrator.retrieval.ResourceType;

/**
 * System prompts for the delegated-analysis sub-task, one per resource.
 *
 * Each prompt asks for a faithful condensation of one chunk of raw data:
 * no opinions, no review comments, every file or commit accounted for.
 */
final class DigestPrompts {

    private DigestPrompts() {}

    static String forResource(ResourceType resource) {
        return switch (resource) {
            case PR_FILES, PR_DIFF -> CHANGED_FILES_PROMPT;
            case COMMIT_HISTORY    -> COMMITS_PROMPT;
            default -> throw new IllegalArgumentException("No digest prompt for " + resource);
        };
    }

    private static final String CHANGED_FILES_PROMPT = """
            You condense pull-request file changes for another engineer who cannot
            read the full diff.

            You receive one chunk of a larger change-set as JSON: one object per
            changed file with its filename, status, additions, deletions and patch.

            Produce, for EVERY file in the chunk, one line:
              <path> (<status>, +<additions>/-<deletions>): <what changed, max 25 words>

            Then a short "Notable" list (at most 5 bullets) covering API changes,
            deleted code paths, new dependencies, configuration or migration changes.

            Rules:
              - Do not skip files. Do not invent files.
              - Describe what changed, not whether it is good.
              - Plain text only.
            """;

    private static final String COMMITS_PROMPT = """
            You condense a pull request's commit history for another engineer.

            You receive one chunk of the history as JSON: one object per commit with
            its sha, author, date and message.

            Produce one line per commit, oldest first:
              <short sha> <author> <date>: <subject line, verbatim> [<ticket keys, if any>]

            Then one sentence summarising what this chunk of commits does as a whole.

            Rules:
              - Keep subject lines verbatim; do not rewrite them.
              - Do not skip commits. Plain text only.
            """;
}
