package club.agentgate.service;

import club.agentgate.dto.RateLimitStatus;
import club.agentgate.support.MutableClock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void fixedWindowExampleWithRollover() {
        var clock = MutableClock.atEpochMillis(0);
        var limiter = new RateLimiter(2, 1000, clock);

        var first = limiter.check("x");
        var second = limiter.check("x");
        var third = limiter.check("x");

        assertTrue(first.allowed());
        assertEquals(1, first.remaining());
        assertTrue(second.allowed());
        assertEquals(0, second.remaining());
        assertFalse(third.allowed());
        assertEquals(0, third.remaining());
        assertEquals(Instant.ofEpochMilli(1000), third.resetTime());

        clock.setMillis(1001);
        var afterReset = limiter.check("x");
        assertTrue(afterReset.allowed());
        assertEquals(1, afterReset.remaining());
        assertEquals(Instant.ofEpochMilli(2001), afterReset.resetTime());
    }

    @Test
    void requestAtExactResetTimeStaysInOldWindow() {
        var clock = MutableClock.atEpochMillis(0);
        var limiter = new RateLimiter(1, 1000, clock);

        assertTrue(limiter.check("x").allowed());
        clock.setMillis(1000);
        assertFalse(limiter.check("x").allowed());
        clock.setMillis(1001);
        assertTrue(limiter.check("x").allowed());
    }

    @Test
    void nPlusFirstRequestIsRejectedWithDefaults() {
        var limiter = new RateLimiter(100, 60_000, MutableClock.atEpochMillis(5_000));

        for (int i = 0; i < 100; i++) {
            var status = limiter.check("agent-1");
            assertTrue(status.allowed(), "request " + (i + 1) + " should be allowed");
            assertEquals(100 - (i + 1), status.remaining());
        }
        var rejected = limiter.check("agent-1");
        assertFalse(rejected.allowed());
        assertEquals(0, rejected.remaining());
    }

    @Test
    void identifiersAreCountedIndependently() {
        var limiter = new RateLimiter(1, 1000, MutableClock.atEpochMillis(0));

        assertTrue(limiter.check("a").allowed());
        assertFalse(limiter.check("a").allowed());
        assertTrue(limiter.check("b").allowed());
        assertEquals(2, limiter.trackedIdentifiers());
    }

    @Test
    void evictExpiredRemovesOnlyElapsedWindows() {
        var clock = MutableClock.atEpochMillis(0);
        var limiter = new RateLimiter(5, 1000, clock);
        limiter.check("old");
        clock.setMillis(600);
        limiter.check("fresh");

        clock.setMillis(1200);
        assertEquals(1, limiter.evictExpired());
        assertEquals(1, limiter.trackedIdentifiers());

        limiter.reset();
        assertEquals(0, limiter.trackedIdentifiers());
    }

    @Test
    void rejectsNonPositiveConfiguration() {
        var clock = MutableClock.atEpochMillis(0);
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 1000, clock));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(10, 0, clock));
    }

    @Test
    void concurrentCallersNeverExceedTheLimit() throws Exception {
        int maxRequests = 25;
        int callers = 200;
        var limiter = new RateLimiter(maxRequests, 60_000, MutableClock.atEpochMillis(0));
        var executor = Executors.newFixedThreadPool(16);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<RateLimitStatus>>();
            for (int i = 0; i < callers; i++) {
                Callable<RateLimitStatus> call = () -> {
                    start.await();
                    return limiter.check("shared");
                };
                futures.add(executor.submit(call));
            }
            start.countDown();

            int accepted = 0;
            for (var future : futures) {
                if (future.get(10, TimeUnit.SECONDS).allowed()) {
                    accepted++;
                }
            }
            assertEquals(Math.min(callers, maxRequests), accepted);
        } finally {
            executor.shutdownNow();
        }
    }
}
