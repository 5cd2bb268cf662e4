package com.devflow.orchestrator.retrieval.probe;

import com.devflow.orchestrator.retrieval.RetrievalStrategy;

public class ProbeNotFoundException extends RuntimeException {
    public ProbeNotFoundException(RetrievalStrategy strategy) {
        super("No probe registered for strategy: " + strategy);
    }
}
