package com.devflow.orchestrator.api.dto;

/** Request body for the {@code .../validate} endpoints: the text exactly as the user wrote it. */
public record RawTextRequest(String raw) {}
