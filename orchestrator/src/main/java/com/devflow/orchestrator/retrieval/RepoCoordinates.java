package com.devflow.orchestrator.retrieval;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code owner/repo#number} split into its parts. */
public record RepoCoordinates(String owner, String repo, int number) {

    private static final Pattern KEY = Pattern.compile("([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+)#([0-9]{1,9})");

    /**
     * @throws IllegalArgumentException if the key is not {@code owner/repo#number}
     */
    public static RepoCoordinates parse(String key) {
        Matcher m = KEY.matcher(key == null ? "" : key.strip());
        if (!m.matches()) {
            throw new IllegalArgumentException("Expected owner/repo#number but got: '" + key + "'");
        }
        return new RepoCoordinates(m.group(1), m.group(2), Integer.parseInt(m.group(3)));
    }

    /** {@code owner/repo}, as the CLI's {@code --repo} flag expects it. */
    public String slug() {
        return owner + "/" + repo;
    }

    @Override
    public String toString() {
        return slug() + "#" + number;
    }
}
