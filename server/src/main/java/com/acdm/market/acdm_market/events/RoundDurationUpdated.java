package com.acdm.market.acdm_market.events;

import lombok.Value;

@Value
public class RoundDurationUpdated implements MarketEvent {
    long seconds;
}
