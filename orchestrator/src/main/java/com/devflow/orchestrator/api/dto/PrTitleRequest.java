package com.devflow.orchestrator.api.dto;

/** Request body for POST /conventions/pr-titles. */
public record PrTitleRequest(String ticket, String summary) {}
