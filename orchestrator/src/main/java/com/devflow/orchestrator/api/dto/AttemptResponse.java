package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.retrieval.ProbeAttempt;

public record AttemptResponse(String strategy, String outcome, long elapsedMs) {

    public static AttemptResponse from(ProbeAttempt a) {
        return new AttemptResponse(a.strategy().name(), a.outcome().name(), a.elapsedMs());
    }
}
