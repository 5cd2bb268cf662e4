package com.devflow.orchestrator.cli;

/**
 * Outcome of one local command invocation.
 *
 * @param exitCode   process exit code; -1 when the process was killed on timeout
 * @param timedOut   true if the command was killed for exceeding its timeout
 */
public record CommandResult(
        int     exitCode,
        String  stdout,
        String  stderr,
        double  elapsedSec,
        boolean timedOut) {

    /** True if the command ran to completion and exited 0. */
    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    /** First non-blank stderr line, for log messages and failure causes. */
    public String firstErrorLine() {
        if (stderr == null) return "";
        return stderr.lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .map(String::strip)
                .orElse("");
    }
}
