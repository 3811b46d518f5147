package com.acdm.market.acdm_market.exception;

/**
 * Invalid amount, price, address, rate or insufficient balance.
 */
public class ValidationException extends MarketException {

    public static final String REASON = "ValidationError";

    public ValidationException(String message) {
        super(REASON, message);
    }
}
