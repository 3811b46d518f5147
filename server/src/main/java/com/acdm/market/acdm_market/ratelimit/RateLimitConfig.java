package com.acdm.market.acdm_market.ratelimit;

import java.time.Clock;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import com.acdm.market.acdm_market.config.MarketProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

/**
 * Rate limiting for the market API, sized by {@code market.rate-limit.*}.
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class RateLimitConfig {

    private final MarketProperties properties;
    private final Clock clock;

    @Bean
    public RateLimiter rateLimiter() {
        MarketProperties.RateLimit settings = properties.getRateLimit();
        return new TokenBucketRateLimiter(settings.getCapacity(), settings.getRefillRate(), clock);
    }

    @Bean
    public RateLimitFilter rateLimitFilter(RateLimiter rateLimiter, ObjectMapper objectMapper) {
        return new RateLimitFilter(rateLimiter, properties.getRateLimit().getExemptedPaths(), objectMapper);
    }

    // Only the security chain runs the filter.
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter rateLimitFilter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Scheduled(fixedRate = 300000)
    public void cleanupRateLimiter() {
        rateLimiter().cleanup();
    }
}
