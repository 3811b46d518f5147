package com.acdm.market.acdm_market.exception;

public enum GuardReason {

    /**
     * The current round phase (or its expiry) does not allow the call.
     */
    INAPPROPRIATE_ROUND("InappropriateRound"),

    /**
     * A call arrived while another call was still executing, typically from a
     * payment recipient re-entering the engine.
     */
    REENTRANT_CALL("ReentrantCall");

    private final String code;

    GuardReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
