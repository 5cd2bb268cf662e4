package com.devflow.orchestrator.convention;

/**
 * Thrown when caller-supplied text does not satisfy a naming convention.
 *
 * The caller must fix the input; the engine never coerces it and nothing
 * retries it. Unchecked, in the same way the rest of the service reports
 * caller errors.
 */
public class InvalidFormatException extends RuntimeException {

    private final FormatRule rule;
    private final String     input;

    public InvalidFormatException(FormatRule rule, String input) {
        this(rule, input, rule.description());
    }

    protected InvalidFormatException(FormatRule rule, String input, String detail) {
        super("[" + rule + "] " + detail + ": '" + input + "'");
        this.rule  = rule;
        this.input = input;
    }

    public FormatRule getRule() { return rule; }

    /** The trimmed text that failed validation. */
    public String getInput() { return input; }
}
