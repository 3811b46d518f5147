package com.acdm.market.acdm_market.events;

import lombok.Value;

import java.math.BigInteger;

@Value
public class SaleTokenBought implements MarketEvent {
    String buyer;
    BigInteger amount;
    BigInteger cost;
}
