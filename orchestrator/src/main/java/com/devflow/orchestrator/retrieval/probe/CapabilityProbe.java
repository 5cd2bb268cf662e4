package com.devflow.orchestrator.retrieval.probe;

import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;

/**
 * Executes one {@link RetrievalStrategy} against an external collaborator.
 *
 * A probe never decides whether to retry or fall back; it reports what
 * happened as a {@link RetrievalOutcome} and the orchestrator does the rest.
 * Known failure modes of the collaborator (auth errors, oversized responses,
 * timeouts, 5xx) must be mapped to outcomes rather than thrown.
 *
 * <p>Each probe is a Spring {@code @Component}; {@link ProbeRegistry}
 * collects them at startup, one per strategy.
 */
public interface CapabilityProbe {

    /** Identity, strategy and supported resources. */
    ProbeManifest manifest();

    /** Capacity ceiling the orchestrator ranks and prunes by. */
    ProbePolicy policy();

    /**
     * Suitability predicate. The default accepts every resource listed in the
     * manifest; probes with runtime preconditions narrow it further.
     */
    default boolean supports(RetrievalRequest request) {
        return manifest().resources().contains(request.resource());
    }

    /**
     * Blocking call to the collaborator. Runs on a probe worker thread and
     * may be interrupted when the fetch times out or is cancelled.
     */
    RetrievalOutcome invoke(RetrievalRequest request);

    default RetrievalStrategy strategy() {
        return manifest().strategy();
    }
}
