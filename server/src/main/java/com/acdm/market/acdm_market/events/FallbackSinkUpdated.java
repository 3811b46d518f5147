package com.acdm.market.acdm_market.events;

import lombok.Value;

@Value
public class FallbackSinkUpdated implements MarketEvent {
    String fallbackSink;
}
