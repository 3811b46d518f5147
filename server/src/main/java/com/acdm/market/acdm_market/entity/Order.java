package com.acdm.market.acdm_market.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Sell order posted during a trade round.
 *
 * The tokens of an order are escrowed by the engine for as long as the order exists.
 * Lifecycle:
 * - created with remainingAmount == amount
 * - remainingAmount shrinks with every redeem until it reaches zero
 * - the record disappears only through removeOrder, a filled order stays until its owner removes it
 *
 * Ids are never reused.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "orders")
public class Order {

    @Id
    private Long id;

    @Indexed
    private String owner;

    /**
     * Native base units per whole token.
     */
    private BigInteger pricePerToken;

    /**
     * Amount escrowed when the order was added, in token base units.
     */
    private BigInteger amount;

    private BigInteger remainingAmount;

    /**
     * Epoch seconds.
     */
    private long createdAt;

    private long updatedAt;

    /**
     * Take {@code granted} tokens off the order.
     *
     * @throws IllegalStateException if more than the remaining amount is requested
     */
    public void fill(BigInteger granted, long now) {
        if (granted.signum() <= 0) {
            throw new IllegalArgumentException("Fill amount must be positive");
        }
        if (granted.compareTo(remainingAmount) > 0) {
            throw new IllegalStateException(
                String.format("Overfill: requested %s, remaining %s (orderId=%d)", granted, remainingAmount, id));
        }
        this.remainingAmount = remainingAmount.subtract(granted);
        this.updatedAt = now;
    }

    public boolean isFilled() {
        return remainingAmount.signum() == 0;
    }

    public BigInteger getFilledAmount() {
        return amount.subtract(remainingAmount);
    }

    public Order copy() {
        return toBuilder().build();
    }
}
