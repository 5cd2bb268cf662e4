package com.devflow.orchestrator.github;

import java.util.Locale;

/**
 * Thrown when the GitHub REST API returns a non-2xx status or cannot be reached.
 *
 * A status code of 0 means the request never got a response (connection
 * refused, timeout, interrupted). A list that still had pages left when
 * the page limit was reached is reported as too large, never returned cut short.
 */
public class GitHubApiException extends RuntimeException {

    private final int     statusCode;
    private final String  body;
    private final boolean truncated;

    public GitHubApiException(int statusCode, String message, String body) {
        this(statusCode, message, body, false);
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.body       = "";
        this.truncated  = false;
    }

    private GitHubApiException(int statusCode, String message, String body, boolean truncated) {
        super(message);
        this.statusCode = statusCode;
        this.body       = body == null ? "" : body;
        this.truncated  = truncated;
    }

    /** A paginated list with more pages than the client is allowed to follow. */
    public static GitHubApiException truncated(String path, int pages, int items) {
        return new GitHubApiException(200,
                "%s has more than %d pages (%d items read)".formatted(path, pages, items), "", true);
    }

    public int statusCode() { return statusCode; }
    public String body()    { return body; }

    public boolean isTransport() {
        return statusCode == 0;
    }

    /** 429, or a 403 whose body says the rate limit was hit. */
    public boolean isRateLimited() {
        return statusCode == 429
            || (statusCode == 403 && body.toLowerCase(Locale.ROOT).contains("rate limit"));
    }

    public boolean isTruncated() {
        return truncated;
    }

    /**
     * 406/422 responses GitHub sends when a diff is too big to render, or a
     * list cut off at the page limit.
     */
    public boolean isTooLarge() {
        String lower = body.toLowerCase(Locale.ROOT);
        return truncated
            || statusCode == 406
            || (statusCode == 422 && (lower.contains("too_large") || lower.contains("too large")
                                      || lower.contains("too long")));
    }
}
