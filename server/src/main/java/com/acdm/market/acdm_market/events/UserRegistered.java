package com.acdm.market.acdm_market.events;

import lombok.Value;

@Value
public class UserRegistered implements MarketEvent {
    String referee;
    String sponsor;
}
