package com.acdm.market.acdm_market.events;

import com.acdm.market.acdm_market.engine.PayoutKind;

import lombok.Value;

import java.math.BigInteger;

/**
 * One referral share left the engine. Fallback payments carry kind FALLBACK.
 */
@Value
public class ReferralRewardPaid implements MarketEvent {
    String recipient;
    BigInteger amount;
    PayoutKind kind;
}
