package io.xrelay.gateway;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

final class RateLimiterTest {

    @Test
    void globalWindowBlocksAfterLimitAndResets() {
        AtomicLong now = new AtomicLong(1_000L);
        RateLimiter limiter = new RateLimiter(2, 10, 60_000L, now::get);

        RateLimiter.Decision first = limiter.checkGlobal();
        Assertions.assertTrue(first.allowed());
        Assertions.assertEquals(1, first.remaining());
        Assertions.assertTrue(limiter.checkGlobal().allowed());

        now.set(31_000L);
        RateLimiter.Decision blocked = limiter.checkGlobal();
        Assertions.assertFalse(blocked.allowed());
        Assertions.assertEquals(30_000L, blocked.resetInMs());
        Assertions.assertEquals(30L, blocked.retryAfterSeconds());

        now.set(61_001L);
        Assertions.assertTrue(limiter.checkGlobal().allowed());
    }

    @Test
    void keysHaveIndependentWindows() {
        AtomicLong now = new AtomicLong(0L);
        RateLimiter limiter = new RateLimiter(100, 1, 1_000L, now::get);
        Assertions.assertTrue(limiter.checkByKey("1.1.1.1").allowed());
        Assertions.assertFalse(limiter.checkByKey("1.1.1.1").allowed());
        Assertions.assertTrue(limiter.checkByKey("2.2.2.2").allowed());
        Assertions.assertEquals(2, limiter.trackedKeys());

        now.set(1_001L);
        Assertions.assertEquals(2, limiter.cleanupExpired());
        Assertions.assertEquals(0, limiter.trackedKeys());
    }

    @Test
    void retryAfterRoundsUp() {
        Assertions.assertEquals(1L, new RateLimiter.Decision(false, 0, 1L).retryAfterSeconds());
        Assertions.assertEquals(2L, new RateLimiter.Decision(false, 0, 1_001L).retryAfterSeconds());
    }
}
