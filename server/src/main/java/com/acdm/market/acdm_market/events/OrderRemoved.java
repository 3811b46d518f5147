package com.acdm.market.acdm_market.events;

import lombok.Value;

import java.math.BigInteger;

@Value
public class OrderRemoved implements MarketEvent {
    long orderId;
    BigInteger returnedAmount;
}
