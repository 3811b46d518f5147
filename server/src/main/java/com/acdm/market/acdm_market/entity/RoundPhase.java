package com.acdm.market.acdm_market.entity;

/**
 * Round phases. Rounds strictly alternate SALE → TRADE → SALE ...
 */
public enum RoundPhase {

    /**
     * Primary issuance: a freshly minted batch is sold at one fixed price.
     */
    SALE,

    /**
     * Secondary market: holders post sell orders that anyone can redeem.
     */
    TRADE;
}
