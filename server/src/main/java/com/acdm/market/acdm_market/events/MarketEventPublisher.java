package com.acdm.market.acdm_market.events;

@FunctionalInterface
public interface MarketEventPublisher {

    void publish(MarketEvent event);
}
