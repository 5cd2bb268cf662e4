package com.devflow.orchestrator.api.dto;

/** Request body for POST /conventions/tickets/extract. */
public record TicketExtractionRequest(String text) {}
