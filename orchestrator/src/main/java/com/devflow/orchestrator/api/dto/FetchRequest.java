package com.devflow.orchestrator.api.dto;

/**
 * Request body for POST /retrievals.
 *
 * Required: resource (a ResourceType name, any case), key
 * Optional: sizeHint in approximate tokens
 */
public record FetchRequest(String resource, String key, Long sizeHint) {}
