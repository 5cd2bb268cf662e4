package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.convention.InvalidFormatException;
import com.devflow.orchestrator.convention.LineTooLongException;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 422 body for a convention violation. length and limit are only present
 * for LINE_TOO_LONG.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConventionErrorResponse(
        String  error,
        String  rule,
        String  message,
        Integer length,
        Integer limit
) {
    public static ConventionErrorResponse from(InvalidFormatException e) {
        if (e instanceof LineTooLongException tooLong) {
            return new ConventionErrorResponse("LINE_TOO_LONG", e.getRule().name(), e.getMessage(),
                    tooLong.getLength(), tooLong.getLimit());
        }
        return new ConventionErrorResponse("INVALID_FORMAT", e.getRule().name(), e.getMessage(), null, null);
    }
}
