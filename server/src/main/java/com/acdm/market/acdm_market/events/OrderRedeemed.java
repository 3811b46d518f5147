package com.acdm.market.acdm_market.events;

import lombok.Value;

import java.math.BigInteger;

@Value
public class OrderRedeemed implements MarketEvent {
    long orderId;
    String buyer;
    BigInteger amount;
    BigInteger price;
}
