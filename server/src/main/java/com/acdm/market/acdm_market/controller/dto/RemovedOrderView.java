package com.acdm.market.acdm_market.controller.dto;

import java.math.BigInteger;

import lombok.Value;

@Value
public class RemovedOrderView {
    long orderId;
    BigInteger returnedAmount;
}
