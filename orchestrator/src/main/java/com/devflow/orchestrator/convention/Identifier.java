package com.devflow.orchestrator.convention;

import java.util.Optional;

/**
 * A string that has passed one of the naming grammars.
 *
 * Instances only come out of {@link ConventionEngine}; they are immutable
 * and are not stored anywhere.
 */
public sealed interface Identifier permits BranchName, CommitSubject, PrTitle {

    /** Canonical text form, e.g. {@code sp/TITAN-149-pii-service}. */
    String value();

    /** The ticket carried by this identifier, if its grammar has one. */
    Optional<TicketRef> ticket();
}
