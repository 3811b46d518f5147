package com.acdm.market.acdm_market.ratelimit;

/**
 * Per-client request budget in front of the market API.
 */
public interface RateLimiter {

    /**
     * @return true if the request is allowed, false if the budget is spent
     */
    boolean tryAcquire(String identifier);

    /**
     * Takes a permit or throws {@link RateLimitExceededException}.
     */
    default void acquire(String identifier) {
        if (!tryAcquire(identifier)) {
            throw new RateLimitExceededException(identifier, getRetryAfterSeconds(identifier));
        }
    }

    /** Seconds until the next permit, 0 if one is available. */
    long getRetryAfterSeconds(String identifier);

    void reset(String identifier);

    /** Drops idle, full buckets. */
    void cleanup();
}
