package com.acdm.market.acdm_market.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per identifier: bursts up to {@code capacity}, sustained at {@code refillRate} per second.
 * Refill is computed from the injected clock at millisecond resolution.
 */
public class TokenBucketRateLimiter implements RateLimiter {

    static final Duration IDLE_EVICTION = Duration.ofMinutes(5);

    private final int capacity;
    private final double refillRate;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter(int capacity, double refillRate, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("Refill rate must be positive");
        }
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String identifier) {
        return buckets.computeIfAbsent(identifier, k -> new Bucket()).tryConsume();
    }

    @Override
    public long getRetryAfterSeconds(String identifier) {
        Bucket bucket = buckets.get(identifier);
        if (bucket == null) {
            return 0;
        }
        double tokens = bucket.available();
        if (tokens >= 1.0) {
            return 0;
        }
        return (long) Math.ceil((1.0 - tokens) / refillRate);
    }

    @Override
    public void reset(String identifier) {
        buckets.remove(identifier);
    }

    @Override
    public void cleanup() {
        long cutoff = clock.millis() - IDLE_EVICTION.toMillis();
        buckets.entrySet().removeIf(entry -> entry.getValue().isIdleSince(cutoff));
    }

    int trackedIdentifiers() {
        return buckets.size();
    }

    private class Bucket {
        private double tokens = capacity;
        private long lastRefillMillis = clock.millis();
        private long lastUsedMillis = lastRefillMillis;

        synchronized boolean tryConsume() {
            refill();
            lastUsedMillis = lastRefillMillis;
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        }

        synchronized double available() {
            refill();
            return tokens;
        }

        synchronized boolean isIdleSince(long cutoffMillis) {
            refill();
            return tokens >= capacity && lastUsedMillis < cutoffMillis;
        }

        private void refill() {
            long now = clock.millis();
            long elapsed = now - lastRefillMillis;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed * refillRate / 1000.0);
                lastRefillMillis = now;
            }
        }
    }
}
