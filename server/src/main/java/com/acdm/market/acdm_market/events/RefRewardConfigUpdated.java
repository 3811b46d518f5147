package com.acdm.market.acdm_market.events;

import com.acdm.market.acdm_market.entity.RoundPhase;

import lombok.Value;

@Value
public class RefRewardConfigUpdated implements MarketEvent {
    RoundPhase phase;
    int l1Rate;
    int l2Rate;
}
