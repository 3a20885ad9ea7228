package com.usermanagement.api.gatekeeper;

import com.google.common.base.Ticker;
import com.usermanagement.api.components.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Holds one token bucket per client key (usually the client IP address) for a single rate class, creating buckets
 * lazily on the first request from a key.
 *
 * All reads and writes of a bucket happen inside ConcurrentHashMap.compute for its key. That method is atomic per key
 * and only locks the hash bin holding the key, so requests from different clients do not wait on each other, while
 * the refill-and-decrement sequence for one client can never interleave with another request or with the sweep.
 *
 * Clients churn (especially when keyed on IP address) so buckets are periodically evicted. A bucket that has refilled
 * all the way to capacity holds no information: a fresh bucket would behave identically. The sweep therefore removes
 * every full bucket. A burst arriving just after its bucket was evicted simply gets a new full bucket.
 */
public class RateLimiterRegistry implements TaskScheduler.PeriodicTask, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiterRegistry.class);

    public static final int DEFAULT_SWEEP_PERIOD_SECONDS = 5 * 60;

    public final String name;

    public final RateLimit rateLimit;

    private final Ticker ticker;
    private final int sweepPeriodSeconds;
    private final ConcurrentMap<String, RateBucket> buckets = new ConcurrentHashMap<>();

    private ScheduledFuture<?> sweepFuture;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RateLimiterRegistry (String name, RateLimit rateLimit) {
        this(name, rateLimit, Ticker.systemTicker(), DEFAULT_SWEEP_PERIOD_SECONDS);
    }

    public RateLimiterRegistry (String name, RateLimit rateLimit, Ticker ticker, int sweepPeriodSeconds) {
        checkArgument(sweepPeriodSeconds > 0, "Sweep period must be positive.");
        this.name = checkNotNull(name);
        this.rateLimit = checkNotNull(rateLimit);
        this.ticker = checkNotNull(ticker);
        this.sweepPeriodSeconds = sweepPeriodSeconds;
    }

    /**
     * Take one token from the bucket for the given key, creating a full bucket if none exists.
     * @return true if the request may proceed, false if the client has exhausted its burst and must slow down.
     */
    public boolean allow (String key) {
        checkNotNull(key, "Rate limiting key must not be null.");
        final boolean[] granted = new boolean[1];
        buckets.compute(key, (k, bucket) -> {
            long now = ticker.read();
            if (bucket == null) {
                bucket = new RateBucket(rateLimit, now);
            }
            granted[0] = bucket.tryConsume(now);
            return bucket;
        });
        return granted[0];
    }

    /**
     * Remove every bucket that has refilled to capacity.
     * @return the number of buckets removed.
     */
    public int sweep () {
        AtomicInteger removed = new AtomicInteger();
        for (String key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.isFull(ticker.read())) {
                    removed.incrementAndGet();
                    return null;
                }
                return bucket;
            });
        }
        if (removed.get() > 0) {
            LOG.debug("Rate limiter {} evicted {} idle buckets, {} remain.", name, removed.get(), buckets.size());
        }
        return removed.get();
    }

    /** The number of tokens currently available to the key, or the full burst if the key has no bucket. */
    public double availableTokens (String key) {
        final double[] tokens = { rateLimit.burst };
        buckets.computeIfPresent(key, (k, bucket) -> {
            tokens[0] = bucket.availableTokens(ticker.read());
            return bucket;
        });
        return tokens[0];
    }

    public boolean contains (String key) {
        return buckets.containsKey(key);
    }

    public int size () {
        return buckets.size();
    }

    /** Schedule the periodic sweep. The sweep stops when this registry is closed. */
    public synchronized void startSweeping (TaskScheduler taskScheduler) {
        checkState(!closed.get(), "Rate limiter %s has been closed.", name);
        checkState(sweepFuture == null, "Rate limiter %s is already being swept.", name);
        sweepFuture = taskScheduler.repeatRegularly(this);
    }

    @Override
    public void run () {
        sweep();
    }

    @Override
    public int getPeriodSeconds () {
        return sweepPeriodSeconds;
    }

    public synchronized boolean isSweeping () {
        return sweepFuture != null && !sweepFuture.isDone();
    }

    /** Stop the periodic sweep and discard all buckets. */
    @Override
    public synchronized void close () {
        if (closed.compareAndSet(false, true)) {
            if (sweepFuture != null) {
                sweepFuture.cancel(false);
            }
            buckets.clear();
        }
    }

}
