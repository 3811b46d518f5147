package com.acdm.market.acdm_market.controller.dto;

import java.math.BigInteger;

import com.acdm.market.acdm_market.entity.Order;

import lombok.Value;

@Value
public class OrderView {
    long id;
    String owner;
    BigInteger pricePerToken;
    BigInteger amount;
    BigInteger remainingAmount;
    long createdAt;
    long updatedAt;

    public static OrderView of(Order order) {
        return new OrderView(order.getId(), order.getOwner(), order.getPricePerToken(), order.getAmount(),
                order.getRemainingAmount(), order.getCreatedAt(), order.getUpdatedAt());
    }
}
