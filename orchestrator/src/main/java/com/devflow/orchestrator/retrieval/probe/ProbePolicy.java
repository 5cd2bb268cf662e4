package com.devflow.orchestrator.retrieval.probe;

/**
 * Declared limits of a probe.
 *
 * @param capacityCeiling largest response, in approximate tokens, the probe
 *                        handles reliably; {@link #UNBOUNDED} for no limit.
 */
public record ProbePolicy(long capacityCeiling) {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    public ProbePolicy {
        if (capacityCeiling <= 0) {
            throw new IllegalArgumentException("capacityCeiling must be positive: " + capacityCeiling);
        }
    }

    /**
     * Factory for configured ceilings, where zero or a negative value means
     * "no limit".
     */
    public static ProbePolicy ofCeiling(long configured) {
        return new ProbePolicy(configured <= 0 ? UNBOUNDED : configured);
    }

    public boolean isUnbounded() {
        return capacityCeiling == UNBOUNDED;
    }

    /** True if a response of {@code size} tokens fits under the ceiling. */
    public boolean admits(long size) {
        return size <= capacityCeiling;
    }
}
