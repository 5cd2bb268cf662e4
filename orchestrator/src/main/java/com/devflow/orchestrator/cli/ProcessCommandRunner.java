package com.devflow.orchestrator.cli;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * stdout and stderr are drained on separate threads so a chatty process
 * cannot block on a full pipe while we wait for it.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final ExecutorService streamReaders;

    public ProcessCommandRunner() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("cmd-io-");
        factory.setDaemon(true);
        this.streamReaders = Executors.newCachedThreadPool(factory);
    }

    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        if (streamReaders.isShutdown()) {
            throw new CommandException("Command runner is shut down; not starting '" + command.get(0) + "'");
        }
        log.debug("Running {}", command);
        long start = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CommandException("Could not start '" + command.get(0) + "'", e);
        }
        CompletableFuture<String> out = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), streamReaders);
        CompletableFuture<String> err = CompletableFuture.supplyAsync(
                () -> readFully(process.getErrorStream()), streamReaders);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("'{}' killed after {} ms", command.get(0), timeout.toMillis());
                return new CommandResult(-1, out.getNow(""), err.getNow(""), elapsedSec(start), true);
            }
            return new CommandResult(process.exitValue(),
                    out.get(5, TimeUnit.SECONDS),
                    err.get(5, TimeUnit.SECONDS),
                    elapsedSec(start), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandException("Interrupted while running '" + command.get(0) + "'", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new CommandException("Could not read output of '" + command.get(0) + "'", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static double elapsedSec(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
