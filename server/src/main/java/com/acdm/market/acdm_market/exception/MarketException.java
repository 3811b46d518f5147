package com.acdm.market.acdm_market.exception;

/**
 * Base type for every abort raised by the market engine.
 *
 * A thrown MarketException means the call was rolled back: no state change,
 * token movement or event of that call is observable afterwards.
 * The reason is a stable machine-readable code, the message is for humans.
 */
public abstract class MarketException extends RuntimeException {

    private final String reason;

    protected MarketException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected MarketException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
