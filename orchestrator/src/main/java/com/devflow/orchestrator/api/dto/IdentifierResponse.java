package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.convention.BranchName;
import com.devflow.orchestrator.convention.CommitSubject;
import com.devflow.orchestrator.convention.Identifier;
import com.devflow.orchestrator.convention.PrTitle;
import com.devflow.orchestrator.convention.TicketRef;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated identifier: its kind, canonical value, ticket (if it carries
 * one) and the parts it was assembled from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdentifierResponse(
        String              kind,
        String              value,
        String              ticket,
        Map<String, Object> parts
) {
    public static IdentifierResponse from(Identifier id) {
        Map<String, Object> parts = new LinkedHashMap<>();
        String kind;
        if (id instanceof BranchName b) {
            kind = "BRANCH_NAME";
            parts.put("initials",    b.initials());
            parts.put("description", b.description());
            parts.put("words",       b.wordCount());
        } else if (id instanceof CommitSubject c) {
            kind = "COMMIT_SUBJECT";
            parts.put("type",     c.type().label());
            c.scopeIfPresent().ifPresent(s -> parts.put("scope", s));
            parts.put("breaking", c.breaking());
            parts.put("subject",  c.subject());
        } else if (id instanceof PrTitle p) {
            kind = "PR_TITLE";
            parts.put("summary", p.summary());
        } else {
            throw new IllegalArgumentException("Unknown identifier " + id.getClass().getSimpleName());
        }
        return new IdentifierResponse(kind, id.value(), id.ticket().map(TicketRef::key).orElse(null), parts);
    }
}
