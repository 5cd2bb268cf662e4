package com.devflow.orchestrator.retrieval;

import com.devflow.orchestrator.retrieval.RetrievalOutcome.PermissionDenied;
import com.devflow.orchestrator.retrieval.RetrievalOutcome.SizeExceeded;
import com.devflow.orchestrator.retrieval.RetrievalOutcome.Success;
import com.devflow.orchestrator.retrieval.RetrievalOutcome.TransientFailure;
import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.devflow.orchestrator.retrieval.probe.ProbeRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Chooses a retrieval strategy for a request, runs it, and falls back.
 *
 * Per fetch:
 * <ol>
 *   <li>Rank the probes that support the resource, cheapest first, leaving
 *       out any whose ceiling is below the request's size hint.</li>
 *   <li>Attempt the top-ranked probe.</li>
 *   <li>{@code Success} ends the fetch.</li>
 *   <li>{@code SizeExceeded}: drop the probe and every probe whose ceiling is
 *       not above the estimate, then continue. Final once nothing is left.</li>
 *   <li>{@code TransientFailure}: retry the same probe once after backoff;
 *       a second failure demotes to the next probe.</li>
 *   <li>{@code PermissionDenied}: abort, nothing else is tried.</li>
 * </ol>
 * Attempts within one fetch are strictly sequential, and a fetch makes at
 * most {@code 2 × registered strategies} probe calls.
 *
 * <p>The orchestrator keeps no state between fetches, so any number of
 * fetches may run concurrently. Probe calls run on a worker pool so that a
 * per-call timeout can be enforced and an interrupted caller can cancel
 * the call in flight.
 */
@Service
public class QueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final ProbeRegistry   registry;
    private final BackoffPolicy   backoff;
    private final MeterRegistry   meterRegistry;
    private final Duration        defaultProbeTimeout;
    private final ExecutorService probeExecutor;

    @Autowired
    public QueryOrchestrator(ProbeRegistry registry,
                             BackoffPolicy backoff,
                             MeterRegistry meterRegistry,
                             @Value("${devflow.retrieval.probe-timeout-sec:60}") int probeTimeoutSec) {
        this(registry, backoff, meterRegistry, Duration.ofSeconds(probeTimeoutSec), newProbeExecutor());
    }

    public QueryOrchestrator(ProbeRegistry registry,
                             BackoffPolicy backoff,
                             MeterRegistry meterRegistry,
                             Duration defaultProbeTimeout,
                             ExecutorService probeExecutor) {
        this.registry            = registry;
        this.backoff             = backoff;
        this.meterRegistry       = meterRegistry;
        this.defaultProbeTimeout = defaultProbeTimeout;
        this.probeExecutor       = probeExecutor;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** Fetch with the configured per-call timeout and return the final outcome. */
    public RetrievalOutcome fetch(RetrievalRequest request) {
        return execute(request, defaultProbeTimeout).outcome();
    }

    public FetchReport execute(RetrievalRequest request) {
        return execute(request, defaultProbeTimeout);
    }

    /**
     * Run the fetch and report every attempt made.
     *
     * @param probeTimeout limit for each individual probe call; a call that
     *                     exceeds it is cancelled and counts as a transient failure
     * @throws NoSuitableStrategyException if no probe supports the resource type
     * @throws RetrievalCancelledException if the calling thread is interrupted
     */
    public FetchReport execute(RetrievalRequest request, Duration probeTimeout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(probeTimeout, "probeTimeout");

        MDC.put("resource",     request.resource().name());
        MDC.put("retrievalKey", request.key());
        try {
            return run(request, probeTimeout);
        } finally {
            MDC.remove("resource");
            MDC.remove("retrievalKey");
        }
    }

    @PreDestroy
    public void shutdown() {
        probeExecutor.shutdownNow();
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private FetchReport run(RetrievalRequest request, Duration probeTimeout) {
        List<ProbeAttempt> attempts = new ArrayList<>();

        // ── RANKING ─────────────────────────────────────────────────────────
        List<CapabilityProbe> supported = registry.rank(request);
        if (supported.isEmpty()) {
            throw new NoSuitableStrategyException(request);
        }
        Deque<CapabilityProbe> ranking = new ArrayDeque<>();
        for (CapabilityProbe probe : supported) {
            if (request.hasSizeHint() && !probe.policy().admits(request.sizeHint())) {
                log.debug("Skipping {}: size hint {} exceeds ceiling {}",
                        probe.strategy(), request.sizeHint(), probe.policy().capacityCeiling());
                continue;
            }
            ranking.addLast(probe);
        }
        if (ranking.isEmpty()) {
            return finish(request, new SizeExceeded(null, request.sizeHint()), FetchState.EXHAUSTED, attempts);
        }
        log.debug("Ranked strategies for {}: {}", request,
                ranking.stream().map(CapabilityProbe::strategy).toList());

        int maxAttempts = 2 * registry.size();
        int consecutiveTransient = 0;
        RetrievalOutcome last = null;

        // ── ATTEMPTING ──────────────────────────────────────────────────────
        while (!ranking.isEmpty() && attempts.size() < maxAttempts) {
            CapabilityProbe probe = ranking.peekFirst();
            RetrievalOutcome outcome = attempt(probe, request, probeTimeout, attempts);
            last = outcome;

            if (outcome instanceof Success) {
                return finish(request, outcome, FetchState.SUCCEEDED, attempts);
            }
            if (outcome instanceof PermissionDenied denied) {
                log.warn("{} denied by {}: {}; aborting", request, probe.strategy(), denied.reason());
                return finish(request, outcome, FetchState.ABORTED, attempts);
            }
            if (outcome instanceof SizeExceeded size) {
                // PRUNING
                long estimate = size.estimatedSize();
                consecutiveTransient = 0;
                ranking.removeIf(p -> p == probe || p.policy().capacityCeiling() <= estimate);
                log.warn("{} too large for {} (~{} tokens); remaining strategies: {}",
                        request, probe.strategy(), estimate,
                        ranking.stream().map(CapabilityProbe::strategy).toList());
                continue;
            }

            TransientFailure failure = (TransientFailure) outcome;
            consecutiveTransient++;
            if (consecutiveTransient == 1) {
                log.warn("{} failed transiently on {} ({}); retrying once",
                        request, probe.strategy(), failure.cause());
                pause(probe.strategy(), request);
            } else {
                // DEMOTING
                ranking.removeFirst();
                consecutiveTransient = 0;
                log.warn("{} failed twice on {} ({}); demoting to {}",
                        request, probe.strategy(), failure.cause(),
                        ranking.isEmpty() ? "nothing" : ranking.peekFirst().strategy());
            }
        }

        return finish(request, last, FetchState.EXHAUSTED, attempts);
    }

    /** One probe call on the worker pool, bounded by {@code timeout}. */
    private RetrievalOutcome attempt(CapabilityProbe probe, RetrievalRequest request,
                                     Duration timeout, List<ProbeAttempt> attempts) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RetrievalCancelledException(request, null);
        }
        RetrievalStrategy strategy = probe.strategy();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long start = System.nanoTime();

        Future<RetrievalOutcome> future = probeExecutor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return registry.invoke(strategy, request);
            } finally {
                MDC.clear();
            }
        });

        RetrievalOutcome outcome;
        try {
            outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                outcome = new TransientFailure(strategy, "probe returned no outcome");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            outcome = new TransientFailure(strategy, "timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe {} threw instead of returning an outcome", strategy, cause);
            outcome = new TransientFailure(strategy,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalCancelledException(request, e);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        attempts.add(new ProbeAttempt(strategy, outcome.kind(), elapsedMs));
        log.debug("Attempt {} on {} → {} in {} ms", attempts.size(), strategy, outcome.kind(), elapsedMs);
        return outcome;
    }

    private void pause(RetrievalStrategy strategy, RetrievalRequest request) {
        try {
            backoff.pause(strategy, 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalCancelledException(request, e);
        }
    }

    private FetchReport finish(RetrievalRequest request, RetrievalOutcome outcome,
                               FetchState state, List<ProbeAttempt> attempts) {
        log.info("Fetch {} → {} ({}) after {} attempt(s)",
                request, outcome.kind(), state, attempts.size());
        meterRegistry.counter("devflow.fetch.outcomes",
                "outcome", outcome.kind().name().toLowerCase(Locale.ROOT),
                "state",   state.name().toLowerCase(Locale.ROOT)).increment();
        return new FetchReport(request, outcome, state, attempts);
    }

    private static ExecutorService newProbeExecutor() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("probe-");
        factory.setDaemon(true);
        return Executors.newCachedThreadPool(factory);
    }
}
