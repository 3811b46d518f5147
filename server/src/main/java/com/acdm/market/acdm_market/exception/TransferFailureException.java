package com.acdm.market.acdm_market.exception;

import java.math.BigInteger;

/**
 * The payment gateway refused to deliver native currency to a recipient.
 */
public class TransferFailureException extends MarketException {

    private final String recipient;
    private final BigInteger amount;

    public TransferFailureException(String recipient, BigInteger amount) {
        super("TransferFailure", String.format("Failed to send %s to %s", amount, recipient));
        this.recipient = recipient;
        this.amount = amount;
    }

    public String getRecipient() {
        return recipient;
    }

    public BigInteger getAmount() {
        return amount;
    }
}
