package com.acdm.market.acdm_market.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * The single active round. Embedded in {@link MarketState}.
 *
 * Expiry is never stored: a round is expired once {@code now >= endTime}.
 * All amounts are in base units (token base units for inventory, native base units for prices and volume).
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Round {

    private RoundPhase phase;

    /**
     * Epoch seconds at which the round stops being active.
     */
    private long endTime;

    private BigInteger saleTokensRemaining;

    /**
     * Price of the current (or last) sale round, native base units per whole token.
     */
    private BigInteger salePricePerToken;

    /**
     * Native volume redeemed from orders since the last sale round started.
     * Becomes the budget of the next sale round.
     */
    private BigInteger accumulatedTradeVolume;

    /**
     * Number of sale rounds started so far. Zero means the next sale uses the seed price.
     */
    private long saleRoundCount;

    public boolean isExpired(long now) {
        return now >= endTime;
    }

    public boolean isActive(RoundPhase expectedPhase, long now) {
        return phase == expectedPhase && !isExpired(now);
    }

    public boolean hasInventory() {
        return saleTokensRemaining.signum() > 0;
    }

    public Round copy() {
        return toBuilder().build();
    }
}
