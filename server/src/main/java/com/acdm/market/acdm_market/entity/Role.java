package com.acdm.market.acdm_market.entity;

public enum Role {
    /** Treasury withdrawals, round duration, fallback sink and role management. */
    ADMIN,
    /** Referral reward rates. */
    DAO
}
