package com.devflow.orchestrator.cli;

import java.time.Duration;
import java.util.List;

/** Runs a local command line and captures its output. */
public interface CommandRunner {

    /**
     * @param command executable followed by its arguments (no shell involved)
     * @param timeout wall-clock limit; the process is killed when it is exceeded
     * @throws CommandException if the process cannot be started or the caller is interrupted
     */
    CommandResult run(List<String> command, Duration timeout);
}
