package com.devflow.orchestrator.convention;

/**
 * A line that is otherwise well-formed but longer than the limit.
 *
 * Surfaced separately from plain {@link InvalidFormatException} so callers
 * can offer to shorten the text instead of rejecting it outright.
 */
public class LineTooLongException extends InvalidFormatException {

    private final int length;
    private final int limit;

    public LineTooLongException(String input, int length, int limit) {
        super(FormatRule.LINE_LENGTH, input,
                "line is %d characters (limit: %d)".formatted(length, limit));
        this.length = length;
        this.limit  = limit;
    }

    public int getLength() { return length; }
    public int getLimit()  { return limit; }
}
