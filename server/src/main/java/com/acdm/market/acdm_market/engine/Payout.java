package com.acdm.market.acdm_market.engine;

import lombok.Value;

import java.math.BigInteger;

/**
 * A pending native-currency send out of the engine.
 */
@Value
public class Payout {
    String recipient;
    BigInteger amount;
    PayoutKind kind;
}
