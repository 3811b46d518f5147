package com.acdm.market.acdm_market.ratelimit;

import com.acdm.market.acdm_market.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private final MutableClock clock = MutableClock.ofEpochSecond(1_700_000_000L);
    private final TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3, 1.0, clock);

    @Test
    void allowsBurstUpToCapacityThenRefills() {
        assertTrue(limiter.tryAcquire("user:alice"));
        assertTrue(limiter.tryAcquire("user:alice"));
        assertTrue(limiter.tryAcquire("user:alice"));
        assertFalse(limiter.tryAcquire("user:alice"));
        assertEquals(1, limiter.getRetryAfterSeconds("user:alice"));

        clock.advance(Duration.ofMillis(1_000));
        assertTrue(limiter.tryAcquire("user:alice"));
        assertFalse(limiter.tryAcquire("user:alice"));
    }

    @Test
    void bucketsArePerIdentifier() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("ip:10.0.0.1");
        }

        assertFalse(limiter.tryAcquire("ip:10.0.0.1"));
        assertTrue(limiter.tryAcquire("ip:10.0.0.2"));
        assertEquals(0, limiter.getRetryAfterSeconds("ip:10.0.0.2"));
    }

    @Test
    void acquireThrowsWhenTheBudgetIsSpent() {
        for (int i = 0; i < 3; i++) {
            limiter.acquire("user:bob");
        }

        RateLimitExceededException e =
                assertThrows(RateLimitExceededException.class, () -> limiter.acquire("user:bob"));
        assertEquals("user:bob", e.getIdentifier());
        assertEquals(1, e.getRetryAfterSeconds());

        limiter.reset("user:bob");
        assertDoesNotThrow(() -> limiter.acquire("user:bob"));
    }

    @Test
    void cleanupDropsOnlyIdleFullBuckets() {
        limiter.tryAcquire("user:idle");
        clock.advance(TokenBucketRateLimiter.IDLE_EVICTION.plusSeconds(1));
        limiter.tryAcquire("user:busy");

        limiter.cleanup();

        assertEquals(1, limiter.trackedIdentifiers());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0, 1.0, clock));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(1, 0.0, clock));
    }
}
