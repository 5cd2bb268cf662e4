package com.devflow.orchestrator.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default {@link BackoffPolicy}: initial delay, multiplied per retry, capped.
 */
@Component
public class ExponentialBackoff implements BackoffPolicy {

    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoff.class);

    private final long   initialDelayMs;
    private final double multiplier;
    private final long   maxDelayMs;

    public ExponentialBackoff(
            @Value("${devflow.retrieval.backoff.initial-delay-ms:500}") long initialDelayMs,
            @Value("${devflow.retrieval.backoff.multiplier:2.0}") double multiplier,
            @Value("${devflow.retrieval.backoff.max-delay-ms:5000}") long maxDelayMs) {
        if (initialDelayMs < 0 || multiplier < 1.0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Invalid backoff settings: initial=%d multiplier=%s max=%d"
                    .formatted(initialDelayMs, multiplier, maxDelayMs));
        }
        this.initialDelayMs = initialDelayMs;
        this.multiplier     = multiplier;
        this.maxDelayMs     = maxDelayMs;
    }

    @Override
    public void pause(RetrievalStrategy strategy, int retry) throws InterruptedException {
        long delay = delayFor(retry);
        log.debug("Backing off {} ms before retry {} of {}", delay, retry, strategy);
        Thread.sleep(delay);
    }

    long delayFor(int retry) {
        double raw = initialDelayMs * Math.pow(multiplier, Math.max(0, retry - 1));
        return (long) Math.min(raw, maxDelayMs);
    }
}
