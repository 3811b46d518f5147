package com.acdm.market.acdm_market.ratelimit;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String identifier;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String identifier, long retryAfterSeconds) {
        super(String.format("Rate limit exceeded for %s. Retry after %d seconds.", identifier, retryAfterSeconds));
        this.identifier = identifier;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
