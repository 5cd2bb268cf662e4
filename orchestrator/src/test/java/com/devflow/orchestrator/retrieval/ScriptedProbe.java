package com.devflow.orchestrator.retrieval;

import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.devflow.orchestrator.retrieval.probe.ProbeManifest;
import com.devflow.orchestrator.retrieval.probe.ProbePolicy;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test double for a probe: plays back a fixed script of outcomes, one per
 * call. The last step repeats once the script runs out.
 */
public class ScriptedProbe implements CapabilityProbe {

    private final ProbeManifest manifest;
    private final ProbePolicy   policy;
    private final ConcurrentLinkedDeque<Supplier<RetrievalOutcome>> script = new ConcurrentLinkedDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<String>  seenKeys = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch hangStarted     = new CountDownLatch(1);
    private final CountDownLatch hangInterrupted = new CountDownLatch(1);

    public ScriptedProbe(RetrievalStrategy strategy, long ceiling, ResourceType... resources) {
        Set<ResourceType> supported = resources.length == 0
                ? EnumSet.allOf(ResourceType.class)
                : EnumSet.of(resources[0], resources);
        this.manifest = new ProbeManifest(strategy.name().toLowerCase(), "0.0.1", strategy,
                "scripted " + strategy, supported);
        this.policy   = ProbePolicy.ofCeiling(ceiling);
    }

    public ScriptedProbe then(RetrievalOutcome outcome) {
        script.addLast(() -> outcome);
        return this;
    }

    public ScriptedProbe thenSuccess(String payload) {
        return then(new RetrievalOutcome.Success(strategy(), payload, SizeEstimator.tokens(payload)));
    }

    public ScriptedProbe thenTransient(String cause) {
        return then(new RetrievalOutcome.TransientFailure(strategy(), cause));
    }

    public ScriptedProbe thenTooLarge(long estimate) {
        return then(new RetrievalOutcome.SizeExceeded(strategy(), estimate));
    }

    public ScriptedProbe thenDenied(String reason) {
        return then(new RetrievalOutcome.PermissionDenied(strategy(), reason));
    }

    public ScriptedProbe thenThrow(RuntimeException e) {
        script.addLast(() -> { throw e; });
        return this;
    }

    /** Blocks until interrupted, as a hung collaborator would. */
    public ScriptedProbe thenHang() {
        script.addLast(() -> {
            hangStarted.countDown();
            try {
                Thread.sleep(30_000);
                return new RetrievalOutcome.Success(strategy(), "late", 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                hangInterrupted.countDown();
                return new RetrievalOutcome.TransientFailure(strategy(), "interrupted");
            }
        });
        return this;
    }

    @Override public ProbeManifest manifest() { return manifest; }
    @Override public ProbePolicy   policy()   { return policy; }

    @Override
    public RetrievalOutcome invoke(RetrievalRequest request) {
        calls.incrementAndGet();
        seenKeys.add(MDC.get("retrievalKey"));
        Supplier<RetrievalOutcome> step = script.size() > 1 ? script.pollFirst() : script.peekFirst();
        if (step == null) {
            throw new IllegalStateException("No scripted outcome for " + strategy());
        }
        return step.get();
    }

    public int calls() { return calls.get(); }

    /** True once a hanging step has been entered. */
    public boolean awaitHangStarted(Duration timeout) throws InterruptedException {
        return hangStarted.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** True once a hanging step has been interrupted on its thread. */
    public boolean awaitHangInterrupted(Duration timeout) throws InterruptedException {
        return hangInterrupted.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** MDC retrievalKey as seen on the probe thread, one entry per call. */
    public List<String> seenKeys() { return List.copyOf(seenKeys); }
}
