package com.acdm.market.acdm_market.events;

import lombok.Value;

import java.math.BigInteger;

@Value
public class OrderAdded implements MarketEvent {
    long orderId;
    String owner;
    BigInteger amount;
    BigInteger price;
}
