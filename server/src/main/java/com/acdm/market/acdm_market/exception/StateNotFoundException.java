package com.acdm.market.acdm_market.exception;

/**
 * Unknown, removed or completely filled order id.
 */
public class StateNotFoundException extends MarketException {

    private final long orderId;

    public StateNotFoundException(long orderId, String message) {
        super("StateNotFound", message);
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }
}
