package com.acdm.market.acdm_market.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Referral reward rates in basis points (10000 = 100%), one pair per round phase.
 * Instances are never mutated; updates produce a new config.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class ReferralRewardConfig {

    public static final int MAX_RATE = 10_000;

    private int saleL1;
    private int saleL2;
    private int tradeL1;
    private int tradeL2;

    public int l1Rate(RoundPhase phase) {
        return phase == RoundPhase.SALE ? saleL1 : tradeL1;
    }

    public int l2Rate(RoundPhase phase) {
        return phase == RoundPhase.SALE ? saleL2 : tradeL2;
    }

    public ReferralRewardConfig withRates(RoundPhase phase, int l1, int l2) {
        if (phase == RoundPhase.SALE) {
            return toBuilder().saleL1(l1).saleL2(l2).build();
        }
        return toBuilder().tradeL1(l1).tradeL2(l2).build();
    }

    @Override
    public String toString() {
        return String.format("sale=%d/%d trade=%d/%d", saleL1, saleL2, tradeL1, tradeL2);
    }
}
