package com.acdm.market.acdm_market.events;

import lombok.Value;

import java.math.BigInteger;

@Value
public class FundsWithdrawn implements MarketEvent {
    String recipient;
    BigInteger amount;
}
