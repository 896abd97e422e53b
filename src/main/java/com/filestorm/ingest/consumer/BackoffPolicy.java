package com.filestorm.ingest.consumer;

import java.util.Locale;

/**
 * Capped delay schedule applied after consecutive failed cycles.
 * <p>
 * Linear: {@code min(base * n, cap)}. Exponential: {@code min(base * 2^(n-1), cap)}.
 */
public final class BackoffPolicy {

    public enum Strategy {
        LINEAR,
        EXPONENTIAL
    }

    private final Strategy strategy;
    private final long baseMs;
    private final long capMs;

    public BackoffPolicy(Strategy strategy, long baseMs, long capMs) {
        if (baseMs < 0 || capMs < 0) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.strategy = strategy;
        this.baseMs = baseMs;
        this.capMs = capMs;
    }

    public static BackoffPolicy linear(long baseMs, long capMs) {
        return new BackoffPolicy(Strategy.LINEAR, baseMs, capMs);
    }

    public static BackoffPolicy exponential(long baseMs, long capMs) {
        return new BackoffPolicy(Strategy.EXPONENTIAL, baseMs, capMs);
    }

    public static BackoffPolicy of(String strategy, long baseMs, long capMs) {
        return new BackoffPolicy(Strategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)), baseMs, capMs);
    }

    /**
     * @param consecutiveErrors errors in a row, starting at 1
     * @return delay in milliseconds, never above the cap
     */
    public long delayFor(int consecutiveErrors) {
        if (consecutiveErrors <= 0) {
            return 0;
        }
        long delay;
        if (strategy == Strategy.EXPONENTIAL) {
            int shift = Math.min(consecutiveErrors - 1, 30);
            delay = baseMs << shift;
            if (delay < 0 || (shift > 0 && delay >> shift != baseMs)) {
                delay = capMs;
            }
        } else {
            delay = baseMs * consecutiveErrors;
            if (baseMs != 0 && delay / baseMs != consecutiveErrors) {
                delay = capMs;
            }
        }
        return Math.min(delay, capMs);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public long getBaseMs() {
        return baseMs;
    }

    public long getCapMs() {
        return capMs;
    }
}
