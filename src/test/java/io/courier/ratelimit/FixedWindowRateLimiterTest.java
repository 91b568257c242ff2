package io.courier.ratelimit;

import io.courier.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class FixedWindowRateLimiterTest {

    @Test
    void allowsExactlyCapacityInsideOneWindow() {
        MutableClock clock = MutableClock.atEpochMillis(10_000L);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(3, Duration.ofSeconds(1), clock);
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertFalse(limiter.allow("a"));
        clock.advanceMillis(999L);
        Assertions.assertFalse(limiter.allow("a"));
    }

    @Test
    void windowResetsAtBoundary() {
        MutableClock clock = MutableClock.atEpochMillis(0L);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(2, Duration.ofMillis(500), clock);
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertFalse(limiter.allow("a"));
        clock.advanceMillis(500L);
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertFalse(limiter.allow("a"));
    }

    @Test
    void sendersAreCountedIndependently() {
        MutableClock clock = MutableClock.atEpochMillis(0L);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofSeconds(1), clock);
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow("b"));
        Assertions.assertFalse(limiter.allow("a"));
        Assertions.assertTrue(limiter.allow(null));
        Assertions.assertFalse(limiter.allow(null));
    }

    @Test
    void forgetPurgesSenderState() {
        MutableClock clock = MutableClock.atEpochMillis(0L);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofSeconds(1), clock);
        Assertions.assertTrue(limiter.allow("a"));
        Assertions.assertFalse(limiter.allow("a"));
        limiter.forget("a");
        Assertions.assertFalse(limiter.trackedSenders().contains("a"));
        Assertions.assertTrue(limiter.allow("a"));
    }

    @Test
    void rejectedBurstDoesNotExtendWindow() {
        MutableClock clock = MutableClock.atEpochMillis(0L);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofSeconds(1), clock);
        Assertions.assertTrue(limiter.allow("a"));
        for (int i = 0; i < 1_000; i++) {
            Assertions.assertFalse(limiter.allow("a"));
        }
        clock.advanceMillis(1_000L);
        Assertions.assertTrue(limiter.allow("a"));
    }

    @Test
    void invalidConfigurationIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(0, Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(1, Duration.ZERO));
        Assertions.assertTrue(RateLimiter.permitAll().allow("anyone"));
    }
}
