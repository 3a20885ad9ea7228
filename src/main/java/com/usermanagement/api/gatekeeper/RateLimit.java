package com.usermanagement.api.gatekeeper;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A rate class: how fast a client's token bucket refills and how large a burst it may absorb.
 */
public class RateLimit {

    /** For expensive or abuse-prone endpoints such as uploads of images. */
    public static final RateLimit STRICT = new RateLimit("strict", 1, 2);

    public static final RateLimit MODERATE = new RateLimit("moderate", 10, 20);

    public static final RateLimit LENIENT = new RateLimit("lenient", 100, 200);

    public final String name;

    public final double tokensPerSecond;

    /** The bucket capacity, i.e. how many requests may be made at once by a client that has been idle. */
    public final int burst;

    private RateLimit (String name, double tokensPerSecond, int burst) {
        checkArgument(tokensPerSecond > 0, "Refill rate must be positive.");
        checkArgument(burst >= 1, "Burst size must be at least one.");
        this.name = name;
        this.tokensPerSecond = tokensPerSecond;
        this.burst = burst;
    }

    public static RateLimit custom (String name, double tokensPerSecond, int burst) {
        return new RateLimit(name, tokensPerSecond, burst);
    }

    @Override
    public String toString () {
        return String.format("%s (%s/s, burst %d)", name, tokensPerSecond, burst);
    }
}
