package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.Role;
import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.RoundPhase;

import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;

/**
 * Parameters of a brand-new market.
 *
 * The market starts in an already expired trade round whose accumulated volume
 * is the seed volume, so the first sale round has a real budget to issue against.
 */
@Getter
@Builder
public class MarketGenesis {

    private final String rootAccount;
    private final String custodyAccount;
    private final String adminAccount;
    private final String daoAccount;
    private final String fallbackSink;
    private final BigInteger seedPrice;
    private final BigInteger seedVolume;
    private final long roundDuration;
    private final ReferralRewardConfig rewardConfig;

    public MarketContext create(long now) {
        if (roundDuration <= 0) {
            throw new IllegalArgumentException("Round duration must be positive");
        }
        if (seedVolume == null || seedVolume.signum() < 0) {
            throw new IllegalArgumentException("Seed volume cannot be negative");
        }
        if (fallbackSink == null || fallbackSink.isBlank()) {
            throw new IllegalArgumentException("Fallback sink is required");
        }

        Round round = Round.builder()
                .phase(RoundPhase.TRADE)
                .endTime(0L)
                .saleTokensRemaining(BigInteger.ZERO)
                .salePricePerToken(seedPrice)
                .accumulatedTradeVolume(seedVolume)
                .saleRoundCount(0L)
                .build();

        MarketState state = MarketState.builder()
                .id(MarketState.SINGLETON_ID)
                .round(round)
                .lastOrderId(0L)
                .nativeBalance(BigInteger.ZERO)
                .rewardConfig(rewardConfig)
                .roundDuration(roundDuration)
                .fallbackSink(fallbackSink)
                .lastCommittedAt(now)
                .build();
        if (adminAccount != null && !adminAccount.isBlank()) {
            state.grantRole(Role.ADMIN, adminAccount);
        }
        if (daoAccount != null && !daoAccount.isBlank()) {
            state.grantRole(Role.DAO, daoAccount);
        }
        return MarketContext.genesis(rootAccount, custodyAccount, state, now);
    }
}
