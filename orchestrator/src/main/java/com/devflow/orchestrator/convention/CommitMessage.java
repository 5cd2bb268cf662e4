package com.devflow.orchestrator.convention;

import java.util.List;

/**
 * A full commit message: validated subject, optional body, and the tickets
 * named in its trailer lines ({@code Refs: ABC-1}, {@code Closes: ABC-2}, ...).
 *
 * @param body empty string when the message is a subject line only
 */
public record CommitMessage(CommitSubject subject, String body, List<TicketRef> ticketRefs) {

    public CommitMessage {
        ticketRefs = List.copyOf(ticketRefs);
    }

    public boolean hasBody() { return !body.isEmpty(); }
}
