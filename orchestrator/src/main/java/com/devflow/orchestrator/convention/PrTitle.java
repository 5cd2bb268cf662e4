package com.devflow.orchestrator.convention;

import java.util.Optional;

/** {@code <TICKET>: <summary>}. */
public record PrTitle(TicketRef ticketRef, String summary) implements Identifier {

    @Override
    public String value() {
        return ticketRef.key() + ": " + summary;
    }

    @Override
    public Optional<TicketRef> ticket() {
        return Optional.of(ticketRef);
    }
}
