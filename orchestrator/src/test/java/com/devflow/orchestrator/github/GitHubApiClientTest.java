package com.devflow.orchestrator.github;

import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalOutcome;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.probe.impl.StructuredApiProbe;
import com.devflow.orchestrator.tracker.IssueTrackerClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for GitHubApiClient against a local stub server.
 */
class GitHubApiClientTest {

    HttpServer   server;
    String       baseUrl;
    List<String> authHeaders = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        server.createContext("/repos/octo/widgets/pulls/42/files", exchange -> {
            authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
            String query = exchange.getRequestURI().getQuery();
            if (query.contains("page=2")) {
                respond(exchange, 200, "[{\"filename\":\"C.java\"}]", null);
            } else {
                respond(exchange, 200, "[{\"filename\":\"A.java\"},{\"filename\":\"B.java\"}]",
                        "<" + baseUrl + "/repos/octo/widgets/pulls/42/files?per_page=100&page=2>; rel=\"next\", "
                        + "<" + baseUrl + "/repos/octo/widgets/pulls/42/files?per_page=100&page=2>; rel=\"last\"");
            }
        });
        server.createContext("/repos/octo/widgets/pulls/42", exchange ->
                respond(exchange, 200, "{\"changed_files\":3,\"additions\":3,\"deletions\":0,\"commits\":1}", null));
        server.createContext("/repos/octo/widgets/pulls/7", exchange ->
                respond(exchange, 406, "{\"message\":\"Sorry, the diff exceeded the maximum number of lines\"}", null));
        server.createContext("/repos/octo/private/pulls/1", exchange ->
                respond(exchange, 404, "{\"message\":\"Not Found\"}", null));
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // Paging
    // ------------------------------------------------------------------

    @Test
    void getAllPages_followsLinkHeader() {
        GitHubApiClient client = new GitHubApiClient(baseUrl + "/", "ghp_test", 30, new ObjectMapper());

        ArrayNode files = client.getAllPages("/repos/octo/widgets/pulls/42/files");

        assertThat(files).hasSize(3);
        assertThat(files.get(2).path("filename").asText()).isEqualTo("C.java");
        assertThat(authHeaders).containsOnly("Bearer ghp_test");
    }

    @Test
    void getAllPages_pagesLeftAtMaxPages_reportedTooLarge() {
        GitHubApiClient client = new GitHubApiClient(baseUrl, "", 1, new ObjectMapper());

        assertThatThrownBy(() -> client.getAllPages("/repos/octo/widgets/pulls/42/files"))
                .isInstanceOfSatisfying(GitHubApiException.class, e -> {
                    assertThat(e.isTruncated()).isTrue();
                    assertThat(e.isTooLarge()).isTrue();
                    assertThat(e.isTransport()).isFalse();
                    assertThat(e.isRateLimited()).isFalse();
                    assertThat(e.getMessage()).contains("2 items read");
                });
        assertThat(authHeaders).hasSize(1).containsOnlyNulls();
    }

    @Test
    void getAllPages_lastPageWithinLimit_returnsEverything() {
        GitHubApiClient client = new GitHubApiClient(baseUrl, "", 2, new ObjectMapper());

        assertThat(client.getAllPages("/repos/octo/widgets/pulls/42/files")).hasSize(3);
    }

    @Test
    void structuredFetch_overPageLimit_neverReturnsPartialList() {
        ObjectMapper json = new ObjectMapper();
        GitHubApiClient client = new GitHubApiClient(baseUrl, "", 1, json);
        StructuredApiProbe structured = new StructuredApiProbe(client,
                new IssueTrackerClient("", "", "", json), 25_000);

        RetrievalOutcome outcome = structured.invoke(
                RetrievalRequest.of(ResourceType.PR_FILES, "octo/widgets#42"));

        assertThat(outcome).isInstanceOfSatisfying(RetrievalOutcome.SizeExceeded.class,
                s -> assertThat(s.estimatedSize()).isGreaterThan(25_000));
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void tooLargeDiff_classified() {
        GitHubApiClient client = new GitHubApiClient(baseUrl, "", 30, new ObjectMapper());

        assertThatThrownBy(() -> client.getDiff("/repos/octo/widgets/pulls/7"))
                .isInstanceOfSatisfying(GitHubApiException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(406);
                    assertThat(e.isTooLarge()).isTrue();
                    assertThat(e.isTransport()).isFalse();
                });
    }

    @Test
    void notFound_carriesStatus() {
        GitHubApiClient client = new GitHubApiClient(baseUrl, "", 30, new ObjectMapper());

        assertThatThrownBy(() -> client.getJson("/repos/octo/private/pulls/1"))
                .isInstanceOfSatisfying(GitHubApiException.class,
                        e -> assertThat(e.statusCode()).isEqualTo(404));
    }

    @Test
    void unreachableHost_transportFailure() {
        GitHubApiClient client = new GitHubApiClient("http://127.0.0.1:1", "", 30, new ObjectMapper());

        assertThatThrownBy(() -> client.getJson("/repos/octo/widgets/pulls/42"))
                .isInstanceOfSatisfying(GitHubApiException.class, e -> assertThat(e.isTransport()).isTrue());
    }

    @Test
    void exceptionClassification() {
        assertThat(new GitHubApiException(429, "m", "").isRateLimited()).isTrue();
        assertThat(new GitHubApiException(403, "m", "API rate limit exceeded for user").isRateLimited()).isTrue();
        assertThat(new GitHubApiException(403, "m", "Resource not accessible").isRateLimited()).isFalse();
        assertThat(new GitHubApiException(422, "m", "{\"errors\":[{\"code\":\"too_large\"}]}").isTooLarge()).isTrue();
        assertThat(new GitHubApiException(422, "m", "Validation Failed").isTooLarge()).isFalse();
        assertThat(new GitHubApiException(500, "m", null).body()).isEmpty();
    }

    @Test
    void nextPage_parsesLinkHeader() {
        assertThat(GitHubApiClient.nextPage(
                "<https://api.github.com/x?page=3>; rel=\"next\", <https://api.github.com/x?page=9>; rel=\"last\""))
                .isEqualTo("https://api.github.com/x?page=3");
        assertThat(GitHubApiClient.nextPage("<https://api.github.com/x?page=1>; rel=\"prev\"")).isNull();
        assertThat(GitHubApiClient.nextPage(null)).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void respond(HttpExchange exchange, int status,
                                String body, String link) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        if (link != null) {
            exchange.getResponseHeaders().add("Link", link);
        }
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
