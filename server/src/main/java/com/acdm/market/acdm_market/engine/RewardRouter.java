package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.RootL2Policy;
import com.acdm.market.acdm_market.events.ReferralRewardPaid;

import java.math.BigInteger;

/**
 * Carves referral shares out of a trade value.
 *
 * Rewards are always taken from the base amount, including the fallback case,
 * so {@code net + l1Reward + l2Reward == base} holds on every path.
 */
public class RewardRouter {

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(ReferralRewardConfig.MAX_RATE);

    private final ReferralRegistry registry;
    private final RootL2Policy rootL2Policy;

    public RewardRouter(ReferralRegistry registry, RootL2Policy rootL2Policy) {
        this.registry = registry;
        this.rootL2Policy = rootL2Policy;
    }

    /**
     * Split {@code base} for a trade credited to {@code principal}.
     *
     * @param fallbackSink receives the referral shares nobody is entitled to
     */
    public RewardSplit split(ReferralGraph graph, String fallbackSink, String principal,
            BigInteger base, int l1Rate, int l2Rate) {
        if (base.signum() < 0) {
            throw new IllegalArgumentException("Base amount cannot be negative: " + base);
        }
        requireRate(l1Rate);
        requireRate(l2Rate);

        BigInteger l1Reward = share(base, l1Rate);
        BigInteger l2Reward = share(base, l2Rate);
        RewardSplit.RewardSplitBuilder split = RewardSplit.builder()
                .base(base)
                .l1Reward(l1Reward)
                .l2Reward(l2Reward)
                .net(base.subtract(l1Reward).subtract(l2Reward));

        ReferralChain chain = registry.chainOf(graph, principal);
        if (chain.isEmpty()) {
            addPayout(split, requireSink(fallbackSink), l1Reward.add(l2Reward), PayoutKind.FALLBACK);
            return split.build();
        }

        addPayout(split, chain.getL1(), l1Reward, PayoutKind.REFERRAL_L1);
        if (rootL2Policy == RootL2Policy.FALLBACK_SINK && chain.getL1().equals(graph.rootAccount())) {
            addPayout(split, requireSink(fallbackSink), l2Reward, PayoutKind.FALLBACK);
        } else {
            addPayout(split, chain.getL2(), l2Reward, PayoutKind.REFERRAL_L2);
        }
        return split.build();
    }

    /**
     * Queue the referral payouts of {@code split} on the transaction.
     */
    public void route(MarketTransaction tx, RewardSplit split) {
        for (Payout payout : split.getPayouts()) {
            tx.pay(payout.getRecipient(), payout.getAmount(), payout.getKind());
            tx.emit(new ReferralRewardPaid(payout.getRecipient(), payout.getAmount(), payout.getKind()));
        }
    }

    private static BigInteger share(BigInteger base, int rate) {
        return base.multiply(BigInteger.valueOf(rate)).divide(BASIS_POINTS);
    }

    private static void addPayout(RewardSplit.RewardSplitBuilder split, String recipient, BigInteger amount,
            PayoutKind kind) {
        if (amount.signum() > 0) {
            split.payout(new Payout(recipient, amount, kind));
        }
    }

    private static String requireSink(String fallbackSink) {
        if (fallbackSink == null || fallbackSink.isBlank()) {
            throw new IllegalStateException("Fallback sink is not configured");
        }
        return fallbackSink;
    }

    private static void requireRate(int rate) {
        if (rate < 0 || rate > ReferralRewardConfig.MAX_RATE) {
            throw new IllegalArgumentException("Rate out of range [0, 10000]: " + rate);
        }
    }
}
