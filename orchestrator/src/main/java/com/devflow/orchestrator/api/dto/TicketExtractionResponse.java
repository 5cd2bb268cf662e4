package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.convention.TicketRef;

import java.util.List;
import java.util.Optional;

/**
 * Response body for POST /conventions/tickets/extract.
 *
 * ticket is the first key found (null when found is false); tickets lists
 * every distinct key in order of appearance.
 */
public record TicketExtractionResponse(boolean found, String ticket, List<String> tickets) {

    public static TicketExtractionResponse from(Optional<TicketRef> first, List<TicketRef> all) {
        return new TicketExtractionResponse(
                first.isPresent(),
                first.map(TicketRef::key).orElse(null),
                all.stream().map(TicketRef::key).toList());
    }
}
