package com.acdm.market.acdm_market.events;

import org.springframework.context.ApplicationEventPublisher;

import lombok.RequiredArgsConstructor;

/**
 * Forwards market events to the Spring application context.
 */
@RequiredArgsConstructor
public class SpringMarketEventPublisher implements MarketEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(MarketEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
