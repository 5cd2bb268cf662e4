package com.devflow.orchestrator.convention;

import java.util.Optional;

/**
 * First line of a commit message: {@code <type>(<scope>)!: <subject>}.
 *
 * @param scope    null when the subject has no scope
 * @param breaking true when the type carries the {@code !} marker
 */
public record CommitSubject(CommitType type, String scope, boolean breaking, String subject)
        implements Identifier {

    @Override
    public String value() {
        StringBuilder sb = new StringBuilder(type.label());
        if (scope != null) sb.append('(').append(scope).append(')');
        if (breaking) sb.append('!');
        return sb.append(": ").append(subject).toString();
    }

    @Override
    public Optional<TicketRef> ticket() {
        return Optional.empty();
    }

    public Optional<String> scopeIfPresent() {
        return Optional.ofNullable(scope);
    }
}
