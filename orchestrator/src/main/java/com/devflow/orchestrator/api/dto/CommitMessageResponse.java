package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.convention.CommitMessage;
import com.devflow.orchestrator.convention.TicketRef;

import java.util.List;

/** Response body for POST /conventions/commit-messages/validate. */
public record CommitMessageResponse(
        IdentifierResponse subject,
        String             body,
        List<String>       tickets
) {
    public static CommitMessageResponse from(CommitMessage message) {
        return new CommitMessageResponse(
                IdentifierResponse.from(message.subject()),
                message.body(),
                message.ticketRefs().stream().map(TicketRef::key).toList());
    }
}
