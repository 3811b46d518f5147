package com.acdm.market.acdm_market.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * How one base amount is divided. Always {@code net + l1Reward + l2Reward == base}.
 */
@Value
@Builder
public class RewardSplit {
    BigInteger base;
    BigInteger net;
    BigInteger l1Reward;
    BigInteger l2Reward;
    @Singular
    List<Payout> payouts;

    public BigInteger totalRewards() {
        return l1Reward.add(l2Reward);
    }
}
