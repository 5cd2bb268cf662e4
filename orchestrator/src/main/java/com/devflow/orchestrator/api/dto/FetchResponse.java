package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.retrieval.FetchReport;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body for POST /retrievals.
 *
 * outcome is the tag of the final outcome. Which of payload, estimatedSize,
 * cause and reason are present depends on the tag; absent fields are
 * omitted. strategy is null only when the size hint excluded every strategy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchResponse(
        String                resource,
        String                key,
        String                outcome,
        String                strategy,
        String                finalState,
        String                payload,
        Long                  estimatedSize,
        String                cause,
        String                reason,
        List<AttemptResponse> attempts
) {
    public static FetchResponse from(FetchReport report) {
        RetrievalOutcome o = report.outcome();
        String payload = null;
        Long   size    = null;
        String cause   = null;
        String reason  = null;
        if (o instanceof RetrievalOutcome.Success s) {
            payload = s.payload();
            size    = s.estimatedSize();
        } else if (o instanceof RetrievalOutcome.SizeExceeded s) {
            size    = s.estimatedSize();
        } else if (o instanceof RetrievalOutcome.TransientFailure t) {
            cause   = t.cause();
        } else if (o instanceof RetrievalOutcome.PermissionDenied p) {
            reason  = p.reason();
        }
        return new FetchResponse(
                report.request().resource().name(),
                report.request().key(),
                o.kind().name(),
                o.strategy() != null ? o.strategy().name() : null,
                report.finalState().name(),
                payload,
                size,
                cause,
                reason,
                report.attempts().stream().map(AttemptResponse::from).toList());
    }
}
