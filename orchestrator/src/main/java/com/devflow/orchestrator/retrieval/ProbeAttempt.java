package com.devflow.orchestrator.retrieval;

/** One probe invocation made while serving a fetch. */
public record ProbeAttempt(RetrievalStrategy strategy, RetrievalOutcome.Kind outcome, long elapsedMs) {}
