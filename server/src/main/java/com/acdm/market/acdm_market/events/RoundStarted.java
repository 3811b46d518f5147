package com.acdm.market.acdm_market.events;

import com.acdm.market.acdm_market.entity.RoundPhase;

import lombok.Value;

import java.math.BigInteger;

/**
 * A new round began. For trade rounds price and amount are null.
 */
@Value
public class RoundStarted implements MarketEvent {
    RoundPhase phase;
    BigInteger price;
    BigInteger amount;
    long endTime;

    public static RoundStarted sale(BigInteger price, BigInteger amount, long endTime) {
        return new RoundStarted(RoundPhase.SALE, price, amount, endTime);
    }

    public static RoundStarted trade(long endTime) {
        return new RoundStarted(RoundPhase.TRADE, null, null, endTime);
    }
}
