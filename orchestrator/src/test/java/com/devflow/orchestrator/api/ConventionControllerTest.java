package com.devflow.orchestrator.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for ConventionController.
 *
 * The engine is pure, so nothing is mocked: these tests exercise the real
 * rules through the HTTP mapping and the 422 error body.
 */
@WebMvcTest(ConventionController.class)
class ConventionControllerTest {

    @Autowired MockMvc mockMvc;

    // ------------------------------------------------------------------
    // Branch names
    // ------------------------------------------------------------------

    @Test
    void validateBranchName_valid_returnsIdentifier() throws Exception {
        postJson("/conventions/branch-names/validate", """
                {"raw":"sp/titan-149-pii-service"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("BRANCH_NAME"))
                .andExpect(jsonPath("$.value").value("sp/TITAN-149-pii-service"))
                .andExpect(jsonPath("$.ticket").value("TITAN-149"))
                .andExpect(jsonPath("$.parts.words").value(2));
    }

    @Test
    void validateBranchName_uppercaseInitials_returns422() throws Exception {
        postJson("/conventions/branch-names/validate", """
                {"raw":"SP/titan-149-pii-service"}
                """)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_FORMAT"))
                .andExpect(jsonPath("$.rule").value("BRANCH_INITIALS"))
                .andExpect(jsonPath("$.length").doesNotExist());
    }

    @Test
    void generateBranchName_returnsCanonicalValue() throws Exception {
        postJson("/conventions/branch-names", """
                {"initials":"SP","ticket":"titan-149","description":"PII service cleanup"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("sp/TITAN-149-pii-service-cleanup"));
    }

    // ------------------------------------------------------------------
    // Commits
    // ------------------------------------------------------------------

    @Test
    void validateCommitSubject_valid_returnsParts() throws Exception {
        postJson("/conventions/commit-subjects/validate", """
                {"raw":"feat(detection)!: add custom PII patterns"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("COMMIT_SUBJECT"))
                .andExpect(jsonPath("$.parts.type").value("feat"))
                .andExpect(jsonPath("$.parts.scope").value("detection"))
                .andExpect(jsonPath("$.parts.breaking").value(true))
                .andExpect(jsonPath("$.ticket").doesNotExist());
    }

    @Test
    void validateCommitSubject_trailingPeriod_returns422() throws Exception {
        postJson("/conventions/commit-subjects/validate", """
                {"raw":"feat(detection): add support for custom PII patterns."}
                """)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rule").value("COMMIT_TRAILING_PERIOD"));
    }

    @Test
    void validateCommitSubject_tooLong_returns422WithLengthAndLimit() throws Exception {
        String subject = "feat: " + "a".repeat(67);

        postJson("/conventions/commit-subjects/validate", "{\"raw\":\"" + subject + "\"}")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("LINE_TOO_LONG"))
                .andExpect(jsonPath("$.rule").value("LINE_LENGTH"))
                .andExpect(jsonPath("$.length").value(73))
                .andExpect(jsonPath("$.limit").value(72));
    }

    @Test
    void validateCommitMessage_returnsTrailerTickets() throws Exception {
        postJson("/conventions/commit-messages/validate", """
                {"raw":"fix(auth): refresh expired tokens\\n\\nRetry once on 401.\\n\\nFixes: ops-7"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subject.value").value("fix(auth): refresh expired tokens"))
                .andExpect(jsonPath("$.tickets[0]").value("OPS-7"));
    }

    // ------------------------------------------------------------------
    // Tickets
    // ------------------------------------------------------------------

    @Test
    void extractTickets_found() throws Exception {
        postJson("/conventions/tickets/extract", """
                {"text":"Follow-up to titan-149 and OPS-7"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.ticket").value("TITAN-149"))
                .andExpect(jsonPath("$.tickets.length()").value(2));
    }

    @Test
    void extractTickets_noneFound_isNotAnError() throws Exception {
        postJson("/conventions/tickets/extract", """
                {"text":"nothing to see here"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.tickets").isEmpty());
    }

    // ------------------------------------------------------------------
    // PR titles
    // ------------------------------------------------------------------

    @Test
    void buildPrTitle_returnsTitle() throws Exception {
        postJson("/conventions/pr-titles", """
                {"ticket":"titan-149","summary":"Add PII detection service"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("PR_TITLE"))
                .andExpect(jsonPath("$.value").value("TITAN-149: Add PII detection service"));
    }

    @Test
    void buildPrTitle_emptySummary_returns422() throws Exception {
        postJson("/conventions/pr-titles", """
                {"ticket":"TITAN-149","summary":""}
                """)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rule").value("PR_SUMMARY_EMPTY"));
    }

    @Test
    void validatePrTitle_missingTicket_returns422() throws Exception {
        postJson("/conventions/pr-titles/validate", """
                {"raw":"Add PII detection service"}
                """)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rule").value("PR_TITLE_GRAMMAR"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }
}
