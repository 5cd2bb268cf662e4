package com.devflow.orchestrator.convention;

/**
 * The individual grammar rules enforced by {@link ConventionEngine}.
 *
 * Every {@link InvalidFormatException} names exactly one rule: the first
 * one the input violated, in the order the engine checks them.
 */
public enum FormatRule {
    BLANK_INPUT("input must not be blank"),

    BRANCH_STRUCTURE("branch must have the form <initials>/<TICKET>-<description>"),
    BRANCH_INITIALS("initials must be 1-4 lowercase letters"),
    BRANCH_TICKET("branch must start with a ticket key after the initials, e.g. ABC-123"),
    BRANCH_DESCRIPTION("description must be lowercase kebab-case"),
    BRANCH_DESCRIPTION_LENGTH("description must have 2-6 words"),

    COMMIT_GRAMMAR("subject must have the form <type>(<scope>): <subject>"),
    COMMIT_TYPE("type must be one of " + CommitType.labels()),
    COMMIT_SUBJECT_CASE("subject must not start with an uppercase letter"),
    COMMIT_TRAILING_PERIOD("subject must not end with a period"),
    COMMIT_BODY_SEPARATOR("second line of a commit message must be blank"),
    LINE_LENGTH("line exceeds the maximum length"),

    PR_TICKET("PR title must start with a valid ticket key"),
    PR_SUMMARY_EMPTY("PR summary must not be empty"),
    PR_TITLE_GRAMMAR("PR title must have the form <TICKET>: <summary>");

    private final String description;

    FormatRule(String description) {
        this.description = description;
    }

    public String description() { return description; }
}
