package com.acdm.market.acdm_market.controller.dto;

import java.math.BigInteger;

import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.RoundPhase;

import lombok.Value;

@Value
public class RoundView {
    RoundPhase phase;
    long endTime;
    boolean active;
    BigInteger saleTokensRemaining;
    BigInteger salePricePerToken;
    BigInteger accumulatedTradeVolume;
    long saleRoundCount;

    public static RoundView of(Round round, boolean active) {
        return new RoundView(round.getPhase(), round.getEndTime(), active, round.getSaleTokensRemaining(),
                round.getSalePricePerToken(), round.getAccumulatedTradeVolume(), round.getSaleRoundCount());
    }
}
