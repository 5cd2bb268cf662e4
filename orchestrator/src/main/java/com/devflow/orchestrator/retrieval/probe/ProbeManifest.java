package com.devflow.orchestrator.retrieval.probe;

import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalStrategy;

import java.util.Set;

/**
 * Identity and routing metadata for a probe.
 *
 * @param name        Unique, human-readable name used in logs and metrics, e.g. "github_rest".
 * @param version     Semantic version of the probe implementation.
 * @param strategy    The strategy this probe executes; at most one probe per strategy.
 * @param description One sentence shown by {@code GET /retrievals/strategies}.
 * @param resources   Resource types the probe can serve.
 */
public record ProbeManifest(
        String            name,
        String            version,
        RetrievalStrategy strategy,
        String            description,
        Set<ResourceType> resources) {

    public ProbeManifest {
        resources = Set.copyOf(resources);
    }
}
