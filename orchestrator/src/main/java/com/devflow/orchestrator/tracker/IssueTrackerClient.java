package com.devflow.orchestrator.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Read-only client for a Jira-compatible issue tracker (REST API v2).
 *
 * Optional: when {@code devflow.tracker.base-url} is blank the client
 * reports itself unconfigured and ticket lookups are not offered.
 */
@Component
public class IssueTrackerClient {

    private static final Logger log = LoggerFactory.getLogger(IssueTrackerClient.class);

    private static final String FIELDS =
            "summary,status,issuetype,priority,assignee,reporter,labels,description,updated";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       authHeader;

    public IssueTrackerClient(
            @Value("${devflow.tracker.base-url:}") String baseUrl,
            @Value("${devflow.tracker.user:}") String user,
            @Value("${devflow.tracker.token:}") String token,
            ObjectMapper objectMapper) {
        this.baseUrl    = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authHeader = user.isBlank() ? null : "Basic " + Base64.getEncoder()
                .encodeToString((user + ":" + token).getBytes(StandardCharsets.UTF_8));
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return !baseUrl.isBlank();
    }

    /**
     * Fetch one work item by key, e.g. {@code TITAN-149}.
     *
     * @throws IssueTrackerException on non-2xx status or transport failure
     */
    public JsonNode getIssue(String key) {
        if (!isConfigured()) {
            throw new IllegalStateException("Issue tracker base URL is not configured");
        }
        String url = baseUrl + "/rest/api/2/issue/" + key + "?fields=" + FIELDS;
        log.debug("Fetching tracker issue {}", key);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .GET();
        if (authHeader != null) {
            builder.header("Authorization", authHeader);
        }

        try {
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new IssueTrackerException(resp.statusCode(),
                        "GET issue " + key + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readTree(resp.body());
        } catch (IssueTrackerException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IssueTrackerException("GET issue " + key + " interrupted", e);
        } catch (IOException e) {
            throw new IssueTrackerException("GET issue " + key + " failed", e);
        }
    }
}
