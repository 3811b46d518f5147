package com.acdm.market.acdm_market.exception;

/**
 * Thrown when a call is made in the wrong round phase or while another call is in progress.
 */
public class GuardViolationException extends MarketException {

    private final GuardReason guardReason;

    public GuardViolationException(GuardReason guardReason) {
        super(guardReason.getCode(), guardReason.getCode());
        this.guardReason = guardReason;
    }

    public GuardReason getGuardReason() {
        return guardReason;
    }
}
