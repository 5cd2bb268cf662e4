package com.devflow.orchestrator.convention;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Allowed commit subject types. Matched exactly, lowercase only. */
public enum CommitType {
    FEAT,
    FIX,
    DOCS,
    STYLE,
    REFACTOR,
    PERF,
    TEST,
    BUILD,
    CI,
    CHORE,
    REVERT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommitType> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(t -> t.label().equals(label))
                .findFirst();
    }

    static String labels() {
        return Arrays.stream(values()).map(CommitType::label).collect(Collectors.joining(", "));
    }
}
