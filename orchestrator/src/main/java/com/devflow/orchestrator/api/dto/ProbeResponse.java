package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One registered strategy as listed by GET /retrievals/strategies.
 * capacityCeiling is null for an unbounded probe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeResponse(
        String       strategy,
        String       name,
        String       version,
        String       description,
        Long         capacityCeiling,
        List<String> resources
) {
    public static ProbeResponse from(CapabilityProbe probe) {
        return new ProbeResponse(
                probe.strategy().name(),
                probe.manifest().name(),
                probe.manifest().version(),
                probe.manifest().description(),
                probe.policy().isUnbounded() ? null : probe.policy().capacityCeiling(),
                probe.manifest().resources().stream().sorted().map(ResourceType::name).toList());
    }
}
