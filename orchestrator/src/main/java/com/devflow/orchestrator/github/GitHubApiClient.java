package com.devflow.orchestrator.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP client for the GitHub REST API.
 *
 * Uses java.net.http.HttpClient so every header on the wire is explicit.
 * Only the read endpoints the probes need are wrapped: JSON resources,
 * unified diffs, and paginated list endpoints (followed through the
 * {@code Link: rel="next"} header).
 *
 * Called from probe worker threads, so blocking I/O is fine here.
 */
@Component
public class GitHubApiClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    static final String ACCEPT_JSON = "application/vnd.github+json";
    static final String ACCEPT_DIFF = "application/vnd.github.v3.diff";

    private static final String  API_VERSION = "2022-11-28";
    private static final int     PER_PAGE    = 100;
    private static final Pattern LINK_NEXT   = Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final int          maxPages;

    public GitHubApiClient(
            @Value("${devflow.github.api-base:https://api.github.com}") String baseUrl,
            @Value("${devflow.github.token:}") String token,
            @Value("${devflow.github.max-pages:30}") int maxPages,
            ObjectMapper objectMapper) {
        this.baseUrl  = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token    = token;
        this.maxPages = maxPages;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * GET a single JSON resource, e.g. {@code /repos/o/r/pulls/42}.
     *
     * @throws GitHubApiException on non-2xx status, transport failure or unparseable body
     */
    public JsonNode getJson(String path) {
        String body = send(baseUrl + path, ACCEPT_JSON, "GET " + path).body();
        return parse(body, path);
    }

    /** GET the unified diff of a pull request. */
    public String getDiff(String path) {
        return send(baseUrl + path, ACCEPT_DIFF, "GET diff " + path).body();
    }

    /**
     * GET every page of a list endpoint and concatenate the arrays.
     *
     * @throws GitHubApiException classified as too large when a next page is
     *         still pending after {@code devflow.github.max-pages} pages
     */
    public ArrayNode getAllPages(String path) {
        ArrayNode all = json.createArrayNode();
        String next = baseUrl + path + (path.contains("?") ? "&" : "?") + "per_page=" + PER_PAGE;
        int pages = 0;

        while (next != null && pages < maxPages) {
            HttpResponse<String> resp = send(next, ACCEPT_JSON, "GET page " + (pages + 1) + " of " + path);
            JsonNode page = parse(resp.body(), path);
            if (!page.isArray()) {
                throw new GitHubApiException(resp.statusCode(),
                        "Expected a JSON array from " + path, resp.body());
            }
            all.addAll((ArrayNode) page);
            pages++;
            next = nextPage(resp.headers().firstValue("Link").orElse(null));
        }
        if (next != null) {
            log.warn("Stopped paging {} after {} pages ({} items); more pages pending", path, pages, all.size());
            throw GitHubApiException.truncated(path, pages, all.size());
        }
        return all;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> send(String url, String accept, String opName) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Accept", accept)
                .header("X-GitHub-Api-Version", API_VERSION)
                .GET();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GitHubApiException(opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException(opName + " interrupted", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.debug("{} returned HTTP {}", opName, resp.statusCode());
            throw new GitHubApiException(resp.statusCode(),
                    opName + " failed: HTTP " + resp.statusCode(), resp.body());
        }
        return resp;
    }

    private JsonNode parse(String body, String path) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GitHubApiException("Unparseable response from " + path, e);
        }
    }

    static String nextPage(String linkHeader) {
        if (linkHeader == null) return null;
        Matcher m = LINK_NEXT.matcher(linkHeader);
        return m.find() ? m.group(1) : null;
    }
}
