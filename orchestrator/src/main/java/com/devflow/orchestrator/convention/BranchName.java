package com.devflow.orchestrator.convention;

import java.util.Optional;

/**
 * {@code <initials>/<TICKET>-<description>}, e.g. {@code sp/TITAN-149-pii-service}.
 */
public record BranchName(String initials, TicketRef ticketRef, String description)
        implements Identifier {

    @Override
    public String value() {
        return initials + "/" + ticketRef.key() + "-" + description;
    }

    @Override
    public Optional<TicketRef> ticket() {
        return Optional.of(ticketRef);
    }

    public int wordCount() {
        return description.split("-").length;
    }
}
