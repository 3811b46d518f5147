package com.acdm.market.acdm_market.controller.dto;

import java.math.BigInteger;

import com.acdm.market.acdm_market.entity.ReferralRewardConfig;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration and balances of the market, for the read-only config endpoint.
 */
@Value
@Builder
public class MarketInfoView {
    String rootAccount;
    String custodyAccount;
    int tokenDecimals;
    long roundDuration;
    String fallbackSink;
    BigInteger nativeBalance;
    ReferralRewardConfig rewardConfig;
}
