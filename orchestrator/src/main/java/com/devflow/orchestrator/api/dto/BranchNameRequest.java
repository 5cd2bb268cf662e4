package com.devflow.orchestrator.api.dto;

/**
 * Request body for POST /conventions/branch-names.
 *
 * description is free text ("Fix login timeout"); it is slugged before the
 * branch name is validated.
 */
public record BranchNameRequest(String initials, String ticket, String description) {}
