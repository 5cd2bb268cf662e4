package com.devflow.orchestrator.cli;

/**
 * Thrown when a local command cannot be started, read, or is interrupted.
 * A command that runs and exits non-zero is not an exception; see
 * {@link CommandResult#exitCode()}.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
