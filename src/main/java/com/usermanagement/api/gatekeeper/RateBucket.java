package com.usermanagement.api.gatekeeper;

/**
 * Continuous token bucket for a single client key. Not threadsafe: RateLimiterRegistry only touches a bucket inside
 * the atomic per-key compute of its map, which serializes all access to any one instance.
 */
class RateBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final int capacity;
    private final double tokensPerSecond;

    private double tokens;
    private long lastRefillNanos;

    /** New buckets start full, so the first requests from a client are always allowed up to the burst size. */
    RateBucket (RateLimit rateLimit, long nowNanos) {
        this.capacity = rateLimit.burst;
        this.tokensPerSecond = rateLimit.tokensPerSecond;
        this.tokens = capacity;
        this.lastRefillNanos = nowNanos;
    }

    private void refill (long nowNanos) {
        long elapsedNanos = nowNanos - lastRefillNanos;
        if (elapsedNanos > 0) {
            tokens = Math.min(capacity, tokens + elapsedNanos * tokensPerSecond / NANOS_PER_SECOND);
            lastRefillNanos = nowNanos;
        }
    }

    boolean tryConsume (long nowNanos) {
        refill(nowNanos);
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    boolean isFull (long nowNanos) {
        refill(nowNanos);
        return tokens >= capacity;
    }

    double availableTokens (long nowNanos) {
        refill(nowNanos);
        return tokens;
    }

}
