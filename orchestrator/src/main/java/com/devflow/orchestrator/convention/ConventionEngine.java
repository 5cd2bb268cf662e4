package com.devflow.orchestrator.convention;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates and builds the identifiers a developer workflow produces:
 * branch names, commit subjects and messages, PR titles, and the ticket
 * references inside them.
 *
 * Pure utility class (static methods only, no I/O, no state). Raw input is
 * trimmed first; every other deviation fails with an
 * {@link InvalidFormatException} naming the first rule broken. Casing of
 * descriptions and subjects is checked strictly, ticket detection ignores case.
 */
public final class ConventionEngine {

    public static final int MAX_LINE_LENGTH       = 72;
    public static final int MIN_DESCRIPTION_WORDS = 2;
    public static final int MAX_DESCRIPTION_WORDS = 6;

    private static final Pattern INITIALS = Pattern.compile("[a-z]{1,4}");

    // <TICKET>[-<description>] where the ticket may be in any case
    private static final Pattern BRANCH_REMAINDER = Pattern.compile(
            "([A-Za-z]+-[0-9]+)(?:-(.*))?",
            Pattern.DOTALL);

    private static final Pattern KEBAB = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*");

    // type, optional (scope), optional breaking marker, subject
    private static final Pattern COMMIT_SUBJECT = Pattern.compile(
            "([A-Za-z]+)(?:\\(([^()]*)\\))?(!)?: (\\S.*)");

    private static final Pattern SCOPE = Pattern.compile("[a-z0-9][a-z0-9._/-]*");

    // A leading all-caps word such as PII or README is not a casing violation.
    private static final Pattern LEADING_ACRONYM = Pattern.compile("[A-Z][A-Z0-9]+(?![A-Za-z])");

    // Standalone key: not glued to surrounding letters or digits.
    private static final Pattern TICKET_IN_TEXT = Pattern.compile(
            "(?<![A-Za-z0-9])([A-Za-z]+-[0-9]+)(?![A-Za-z0-9])");

    private static final Pattern TRAILER = Pattern.compile(
            "(?i)(refs|closes|fixes|resolves):\\s*(.+)");

    private static final Pattern BARE_URL = Pattern.compile("\\s*https?://\\S+\\s*");

    private static final Pattern PR_TITLE = Pattern.compile("([A-Za-z]+-[0-9]+): (.*)", Pattern.DOTALL);

    private ConventionEngine() {}

    // ------------------------------------------------------------------
    // Branch names
    // ------------------------------------------------------------------

    /**
     * Validate {@code <initials>/<TICKET>-<kebab-description>}.
     *
     * The ticket may be written in any case and comes back uppercase; the
     * initials and description must already be lowercase.
     */
    public static BranchName validateBranchName(String raw) {
        String input = requireText(raw);

        int slash = input.indexOf('/');
        if (slash < 0 || slash != input.lastIndexOf('/')) {
            throw new InvalidFormatException(FormatRule.BRANCH_STRUCTURE, input);
        }
        String initials  = input.substring(0, slash);
        String remainder = input.substring(slash + 1);

        if (!INITIALS.matcher(initials).matches()) {
            throw new InvalidFormatException(FormatRule.BRANCH_INITIALS, input);
        }

        Matcher m = BRANCH_REMAINDER.matcher(remainder);
        if (!m.matches()) {
            throw new InvalidFormatException(FormatRule.BRANCH_TICKET, input);
        }
        TicketRef ticket = new TicketRef(m.group(1).toUpperCase(Locale.ROOT));

        String description = m.group(2);
        if (description == null || !KEBAB.matcher(description).matches()) {
            throw new InvalidFormatException(FormatRule.BRANCH_DESCRIPTION, input);
        }
        int words = description.split("-").length;
        if (words < MIN_DESCRIPTION_WORDS || words > MAX_DESCRIPTION_WORDS) {
            throw new InvalidFormatException(FormatRule.BRANCH_DESCRIPTION_LENGTH, input);
        }

        return new BranchName(initials, ticket, description);
    }

    /**
     * Assemble a branch name from its parts and validate the result.
     *
     * Initials and description are lower-cased and the description's
     * separators collapse to single hyphens. Nothing is truncated: a
     * seven-word description still fails.
     */
    public static BranchName generateBranchName(String initials, String ticket, String description) {
        String ini = requireText(initials).toLowerCase(Locale.ROOT);
        TicketRef ref = TicketRef.parse(ticket)
                .orElseThrow(() -> new InvalidFormatException(
                        FormatRule.BRANCH_TICKET, ticket == null ? "" : ticket.strip()));
        String slug = requireText(description)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return validateBranchName(ini + "/" + ref.key() + "-" + slug);
    }

    // ------------------------------------------------------------------
    // Commit subjects and messages
    // ------------------------------------------------------------------

    /**
     * Validate a single commit subject line.
     *
     * Grammar, type, casing and trailing-period rules are checked before
     * length, so {@link LineTooLongException} is only raised for a line that
     * is valid apart from being too long.
     */
    public static CommitSubject validateCommitSubject(String raw) {
        String input = requireText(raw);
        if (input.contains("\n") || input.contains("\r")) {
            throw new InvalidFormatException(FormatRule.COMMIT_GRAMMAR, input);
        }

        Matcher m = COMMIT_SUBJECT.matcher(input);
        if (!m.matches()) {
            throw new InvalidFormatException(FormatRule.COMMIT_GRAMMAR, input);
        }

        CommitType type = CommitType.fromLabel(m.group(1))
                .orElseThrow(() -> new InvalidFormatException(FormatRule.COMMIT_TYPE, input));

        String scope = m.group(2);
        if (scope != null && !SCOPE.matcher(scope).matches()) {
            throw new InvalidFormatException(FormatRule.COMMIT_GRAMMAR, input);
        }

        String subject = m.group(4);
        if (Character.isUpperCase(subject.charAt(0)) && !LEADING_ACRONYM.matcher(subject).lookingAt()) {
            throw new InvalidFormatException(FormatRule.COMMIT_SUBJECT_CASE, input);
        }
        if (subject.endsWith(".")) {
            throw new InvalidFormatException(FormatRule.COMMIT_TRAILING_PERIOD, input);
        }
        if (input.length() > MAX_LINE_LENGTH) {
            throw new LineTooLongException(input, input.length(), MAX_LINE_LENGTH);
        }

        return new CommitSubject(type, scope, m.group(3) != null, subject);
    }

    /**
     * Validate a whole commit message: subject, blank separator line, body
     * wrapped at {@value #MAX_LINE_LENGTH} columns (bare URLs excepted).
     * Tickets named in {@code Refs:/Closes:/Fixes:/Resolves:} trailers are
     * collected in order of appearance.
     */
    public static CommitMessage validateCommitMessage(String raw) {
        String input = requireText(raw);
        List<String> lines = input.lines().toList();

        CommitSubject subject = validateCommitSubject(lines.get(0));
        if (lines.size() == 1) {
            return new CommitMessage(subject, "", List.of());
        }
        if (!lines.get(1).isBlank()) {
            throw new InvalidFormatException(FormatRule.COMMIT_BODY_SEPARATOR, input);
        }

        List<String> bodyLines = lines.subList(2, lines.size());
        Set<TicketRef> refs = new LinkedHashSet<>();
        for (String line : bodyLines) {
            String trimmed = line.stripTrailing();
            if (trimmed.length() > MAX_LINE_LENGTH && !BARE_URL.matcher(trimmed).matches()) {
                throw new LineTooLongException(trimmed, trimmed.length(), MAX_LINE_LENGTH);
            }
            Matcher trailer = TRAILER.matcher(trimmed.strip());
            if (trailer.matches()) {
                refs.addAll(extractTicketReferences(trailer.group(2)));
            }
        }

        return new CommitMessage(subject, String.join("\n", bodyLines).strip(), new ArrayList<>(refs));
    }

    // ------------------------------------------------------------------
    // Ticket references
    // ------------------------------------------------------------------

    /**
     * Find the first ticket key in free text, ignoring case.
     *
     * A missing ticket is not an error; callers decide whether they need one.
     * Running this on its own output returns the same ticket.
     */
    public static Optional<TicketRef> extractTicketReference(String text) {
        if (text == null) return Optional.empty();
        Matcher m = TICKET_IN_TEXT.matcher(text);
        return m.find()
                ? Optional.of(new TicketRef(m.group(1).toUpperCase(Locale.ROOT)))
                : Optional.empty();
    }

    /** Every distinct ticket key in the text, in order of first appearance. */
    public static List<TicketRef> extractTicketReferences(String text) {
        if (text == null) return List.of();
        Set<TicketRef> found = new LinkedHashSet<>();
        Matcher m = TICKET_IN_TEXT.matcher(text);
        while (m.find()) {
            found.add(new TicketRef(m.group(1).toUpperCase(Locale.ROOT)));
        }
        return List.copyOf(found);
    }

    // ------------------------------------------------------------------
    // PR titles
    // ------------------------------------------------------------------

    /** Build {@code "<TICKET>: <summary>"}, at most {@value #MAX_LINE_LENGTH} characters. */
    public static PrTitle buildPrTitle(String ticket, String summary) {
        TicketRef ref = TicketRef.parse(ticket)
                .orElseThrow(() -> new InvalidFormatException(
                        FormatRule.PR_TICKET, ticket == null ? "" : ticket.strip()));
        String text = summary == null ? "" : summary.strip();
        if (text.isEmpty()) {
            throw new InvalidFormatException(FormatRule.PR_SUMMARY_EMPTY, ref.key() + ": ");
        }
        PrTitle title = new PrTitle(ref, text);
        String value = title.value();
        if (value.length() > MAX_LINE_LENGTH) {
            throw new LineTooLongException(value, value.length(), MAX_LINE_LENGTH);
        }
        return title;
    }

    /** Parse an existing PR title with the same rules as {@link #buildPrTitle}. */
    public static PrTitle validatePrTitle(String raw) {
        String input = requireText(raw);
        Matcher m = PR_TITLE.matcher(input);
        if (!m.matches()) {
            throw new InvalidFormatException(FormatRule.PR_TITLE_GRAMMAR, input);
        }
        return buildPrTitle(m.group(1), m.group(2));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String requireText(String raw) {
        String input = raw == null ? "" : raw.strip();
        if (input.isEmpty()) {
            throw new InvalidFormatException(FormatRule.BLANK_INPUT, input);
        }
        return input;
    }
}
