package com.usermanagement.api.gatekeeper;

import com.google.common.testing.FakeTicker;
import com.usermanagement.api.components.TaskScheduler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RateLimiterRegistryTest {

    private final FakeTicker ticker = new FakeTicker();

    private RateLimiterRegistry registry (RateLimit rateLimit) {
        return new RateLimiterRegistry("test", rateLimit, ticker, 60);
    }

    @Test
    void burstThenDenial () {
        RateLimiterRegistry registry = registry(RateLimit.MODERATE);
        for (int i = 0; i < 20; i++) {
            assertTrue(registry.allow("10.0.0.1"), "request " + i + " is within the burst");
        }
        assertFalse(registry.allow("10.0.0.1"));
        assertFalse(registry.allow("10.0.0.1"));
    }

    @Test
    void exactlyOneTokenRefillsPerInterval () {
        RateLimiterRegistry registry = registry(RateLimit.STRICT);
        assertTrue(registry.allow("client"));
        assertTrue(registry.allow("client"));
        assertFalse(registry.allow("client"));
        ticker.advance(500, TimeUnit.MILLISECONDS);
        assertFalse(registry.allow("client"));
        ticker.advance(500, TimeUnit.MILLISECONDS);
        assertTrue(registry.allow("client"));
        assertFalse(registry.allow("client"));
    }

    @Test
    void refillIsCappedAtCapacity () {
        RateLimiterRegistry registry = registry(RateLimit.STRICT);
        registry.allow("client");
        ticker.advance(1, TimeUnit.HOURS);
        assertEquals(2, registry.availableTokens("client"), 0);
        assertTrue(registry.allow("client"));
        assertTrue(registry.allow("client"));
        assertFalse(registry.allow("client"));
    }

    @Test
    void keysHaveIndependentBuckets () {
        RateLimiterRegistry registry = registry(RateLimit.STRICT);
        assertTrue(registry.allow("a"));
        assertTrue(registry.allow("a"));
        assertFalse(registry.allow("a"));
        assertTrue(registry.allow("b"));
        assertEquals(2, registry.size());
    }

    @Test
    void concurrentCallersNeverExceedTheBurst () throws Exception {
        final int burst = 100;
        final int threads = 32;
        final int callsPerThread = 20;
        // The ticker does not move, so no tokens are added during the test.
        RateLimiterRegistry registry = registry(RateLimit.custom("test", 1, burst));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        if (registry.allow("shared-client")) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(burst, granted.get());
    }

    @Test
    void sweepRemovesOnlyFullBuckets () {
        RateLimiterRegistry registry = registry(RateLimit.STRICT);
        registry.allow("drained");
        registry.allow("drained");
        registry.allow("touched");
        ticker.advance(1, TimeUnit.SECONDS);
        // "drained" has refilled one of two tokens, "touched" is back to capacity.
        assertEquals(1, registry.sweep());
        assertTrue(registry.contains("drained"));
        assertFalse(registry.contains("touched"));
        ticker.advance(1, TimeUnit.SECONDS);
        assertEquals(1, registry.sweep());
        assertEquals(0, registry.size());
    }

    @Test
    void evictedClientStartsWithAFullBucket () {
        RateLimiterRegistry registry = registry(RateLimit.STRICT);
        registry.allow("client");
        ticker.advance(5, TimeUnit.SECONDS);
        registry.sweep();
        assertFalse(registry.contains("client"));
        assertTrue(registry.allow("client"));
        assertTrue(registry.allow("client"));
        assertFalse(registry.allow("client"));
    }

    @Test
    void periodicSweepStopsOnClose () {
        TaskScheduler taskScheduler = new TaskScheduler(() -> 1);
        try {
            RateLimiterRegistry registry = registry(RateLimit.LENIENT);
            registry.startSweeping(taskScheduler);
            assertTrue(registry.isSweeping());
            assertThrows(IllegalStateException.class, () -> registry.startSweeping(taskScheduler));
            registry.allow("client");
            registry.close();
            assertFalse(registry.isSweeping());
            assertEquals(0, registry.size());
            assertThrows(IllegalStateException.class, () -> registry.startSweeping(taskScheduler));
        } finally {
            taskScheduler.shutDown();
        }
    }

    @Test
    void namedRateClasses () {
        assertEquals(1, RateLimit.STRICT.tokensPerSecond, 0);
        assertEquals(2, RateLimit.STRICT.burst);
        assertEquals(10, RateLimit.MODERATE.tokensPerSecond, 0);
        assertEquals(20, RateLimit.MODERATE.burst);
        assertEquals(100, RateLimit.LENIENT.tokensPerSecond, 0);
        assertEquals(200, RateLimit.LENIENT.burst);
        assertThrows(IllegalArgumentException.class, () -> RateLimit.custom("broken", 0, 1));
        assertThrows(IllegalArgumentException.class, () -> RateLimit.custom("broken", 1, 0));
    }

}
