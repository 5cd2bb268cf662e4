package com.devflow.orchestrator.retrieval;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One unit of retrieval work.
 *
 * @param resource what to fetch
 * @param key      {@code owner/repo#number}, or a tracker key for {@link ResourceType#TICKET}
 * @param sizeHint caller's estimate of the response size in approximate tokens;
 *                 null when unknown
 */
public record RetrievalRequest(ResourceType resource, String key, Long sizeHint) {

    private static final Pattern TICKET_KEY = Pattern.compile("[A-Z]+-[0-9]+");

    // Compact constructor: normalise the key and reject anything malformed up front.
    public RetrievalRequest {
        if (resource == null) {
            throw new IllegalArgumentException("resource is required");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        key = key.strip();
        if (resource.repoScoped()) {
            RepoCoordinates.parse(key);
        } else {
            key = key.toUpperCase(Locale.ROOT);
            if (!TICKET_KEY.matcher(key).matches()) {
                throw new IllegalArgumentException("Expected a ticket key like ABC-123 but got: '" + key + "'");
            }
        }
        if (sizeHint != null && sizeHint < 0) {
            throw new IllegalArgumentException("sizeHint must not be negative: " + sizeHint);
        }
    }

    public static RetrievalRequest of(ResourceType resource, String key) {
        return new RetrievalRequest(resource, key, null);
    }

    /**
     * @throws IllegalStateException for {@link ResourceType#TICKET} requests
     */
    public RepoCoordinates repo() {
        if (!resource.repoScoped()) {
            throw new IllegalStateException(resource + " requests are not repository-scoped");
        }
        return RepoCoordinates.parse(key);
    }

    public boolean hasSizeHint() {
        return sizeHint != null;
    }

    @Override
    public String toString() {
        return resource + " " + key + (sizeHint != null ? " (~" + sizeHint + " tokens)" : "");
    }
}
