package com.devflow.orchestrator.retrieval.probe;

import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * In-process registry of capability probes.
 *
 * All {@link CapabilityProbe} beans are collected at startup via constructor
 * injection, keyed by the strategy they execute.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by strategy ({@link #get}).</li>
 *   <li>Ranking: the probes able to serve a request, cheapest first ({@link #rank}).</li>
 *   <li>Metrics-instrumented invocation ({@link #invoke}): every call is
 *       timed and counted by outcome, with no per-probe boilerplate.</li>
 * </ol>
 */
@Component
public class ProbeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProbeRegistry.class);

    private final Map<RetrievalStrategy, CapabilityProbe> probes = new EnumMap<>(RetrievalStrategy.class);
    private final MeterRegistry meterRegistry;

    /**
     * Spring collects every {@code CapabilityProbe} bean and passes the list here.
     *
     * @throws IllegalStateException if two probes claim the same strategy
     */
    public ProbeRegistry(List<CapabilityProbe> allProbes, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (CapabilityProbe probe : allProbes) {
            CapabilityProbe previous = probes.putIfAbsent(probe.strategy(), probe);
            if (previous != null) {
                throw new IllegalStateException("Strategy %s claimed by both '%s' and '%s'".formatted(
                        probe.strategy(), previous.manifest().name(), probe.manifest().name()));
            }
            log.info("Registered probe '{}' v{} [{}] ceiling={} resources={}",
                    probe.manifest().name(),
                    probe.manifest().version(),
                    probe.strategy(),
                    probe.policy().isUnbounded() ? "unbounded" : probe.policy().capacityCeiling(),
                    probe.manifest().resources());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public CapabilityProbe get(RetrievalStrategy strategy) {
        CapabilityProbe probe = probes.get(strategy);
        if (probe == null) {
            throw new ProbeNotFoundException(strategy);
        }
        return probe;
    }

    /** All registered probes in ascending cost order. */
    public List<CapabilityProbe> all() {
        return List.copyOf(probes.values());
    }

    /** Number of registered strategies; bounds the attempts of a fetch. */
    public int size() {
        return probes.size();
    }

    /**
     * Probes whose suitability predicate accepts the request, cheapest first.
     * EnumMap iteration follows the strategy declaration order, which is the
     * cost order.
     */
    public List<CapabilityProbe> rank(RetrievalRequest request) {
        if (probes.isEmpty()) return Collections.emptyList();
        return probes.values().stream()
                .filter(p -> p.supports(request))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented invocation
    // ------------------------------------------------------------------

    /**
     * Invoke the probe for {@code strategy}, recording:
     * <pre>
     *   devflow.probe.calls{strategy, outcome="success|size_exceeded|transient_failure|permission_denied|error"}
     *   devflow.probe.duration{strategy}
     * </pre>
     * Exceptions thrown by the probe are counted as {@code error} and rethrown.
     */
    public RetrievalOutcome invoke(RetrievalStrategy strategy, RetrievalRequest request) {
        CapabilityProbe probe = get(strategy);
        String strategyTag = strategy.name().toLowerCase(Locale.ROOT);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcomeTag = "error";
        try {
            RetrievalOutcome outcome = probe.invoke(request);
            if (outcome != null) {
                outcomeTag = outcome.kind().name().toLowerCase(Locale.ROOT);
            }
            return outcome;
        } finally {
            sample.stop(meterRegistry.timer("devflow.probe.duration", "strategy", strategyTag));
            meterRegistry.counter("devflow.probe.calls",
                    "strategy", strategyTag, "outcome", outcomeTag).increment();
        }
    }
}
