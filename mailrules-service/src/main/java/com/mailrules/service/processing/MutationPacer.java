package com.mailrules.service.processing;

import com.google.common.util.concurrent.RateLimiter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Spaces out mailbox mutation calls to stay under the provider's rate limits.
 */
public final class MutationPacer {

    private static final Logger logger = Logger.getLogger(MutationPacer.class.getName());

    private final RateLimiter rateLimiter;

    public MutationPacer(double mutationsPerSecond) {
        this.rateLimiter = RateLimiter.create(mutationsPerSecond);
    }

    /**
     * Blocks until the next mutation may be sent.
     *
     * @return seconds spent waiting
     */
    public double acquire() {
        double waited = rateLimiter.acquire();
        if (waited > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Paced mutation for %.3fs", waited));
        }
        return waited;
    }

    public double getRate() {
        return rateLimiter.getRate();
    }
}
