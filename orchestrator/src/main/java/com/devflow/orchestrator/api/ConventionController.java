package com.devflow.orchestrator.api;

import com.devflow.orchestrator.api.dto.BranchNameRequest;
import com.devflow.orchestrator.api.dto.CommitMessageResponse;
import com.devflow.orchestrator.api.dto.ConventionErrorResponse;
import com.devflow.orchestrator.api.dto.IdentifierResponse;
import com.devflow.orchestrator.api.dto.PrTitleRequest;
import com.devflow.orchestrator.api.dto.RawTextRequest;
import com.devflow.orchestrator.api.dto.TicketExtractionRequest;
import com.devflow.orchestrator.api.dto.TicketExtractionResponse;
import com.devflow.orchestrator.convention.ConventionEngine;
import com.devflow.orchestrator.convention.InvalidFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over the convention engine.
 *
 * POST /conventions/branch-names/validate     validate a branch name
 * POST /conventions/branch-names              build a branch name from parts
 * POST /conventions/commit-subjects/validate  validate a commit subject line
 * POST /conventions/commit-messages/validate  validate a full commit message
 * POST /conventions/tickets/extract           find ticket keys in free text
 * POST /conventions/pr-titles                 build a PR title
 * POST /conventions/pr-titles/validate        validate an existing PR title
 *
 * Any violation answers 422 with the rule that was broken.
 */
@RestController
@RequestMapping("/conventions")
public class ConventionController {

    private static final Logger log = LoggerFactory.getLogger(ConventionController.class);

    /**
     * Example:
     *   curl -X POST http://localhost:8080/conventions/branch-names/validate \
     *     -H "Content-Type: application/json" \
     *     -d '{"raw":"jd/abc-123-fix-login-timeout"}'
     */
    @PostMapping("/branch-names/validate")
    public IdentifierResponse validateBranchName(@RequestBody RawTextRequest req) {
        return IdentifierResponse.from(ConventionEngine.validateBranchName(req.raw()));
    }

    @PostMapping("/branch-names")
    public IdentifierResponse generateBranchName(@RequestBody BranchNameRequest req) {
        return IdentifierResponse.from(
                ConventionEngine.generateBranchName(req.initials(), req.ticket(), req.description()));
    }

    @PostMapping("/commit-subjects/validate")
    public IdentifierResponse validateCommitSubject(@RequestBody RawTextRequest req) {
        return IdentifierResponse.from(ConventionEngine.validateCommitSubject(req.raw()));
    }

    @PostMapping("/commit-messages/validate")
    public CommitMessageResponse validateCommitMessage(@RequestBody RawTextRequest req) {
        return CommitMessageResponse.from(ConventionEngine.validateCommitMessage(req.raw()));
    }

    /** Never fails: text without a ticket answers {@code found=false}. */
    @PostMapping("/tickets/extract")
    public TicketExtractionResponse extractTickets(@RequestBody TicketExtractionRequest req) {
        return TicketExtractionResponse.from(
                ConventionEngine.extractTicketReference(req.text()),
                ConventionEngine.extractTicketReferences(req.text()));
    }

    @PostMapping("/pr-titles")
    public IdentifierResponse buildPrTitle(@RequestBody PrTitleRequest req) {
        return IdentifierResponse.from(ConventionEngine.buildPrTitle(req.ticket(), req.summary()));
    }

    @PostMapping("/pr-titles/validate")
    public IdentifierResponse validatePrTitle(@RequestBody RawTextRequest req) {
        return IdentifierResponse.from(ConventionEngine.validatePrTitle(req.raw()));
    }

    @ExceptionHandler(InvalidFormatException.class)
    public ResponseEntity<ConventionErrorResponse> onInvalidFormat(InvalidFormatException e) {
        log.debug("Convention violation: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(ConventionErrorResponse.from(e));
    }
}
