package com.acdm.market.acdm_market.engine;

public enum PayoutKind {
    REFUND,
    SELLER_PROCEEDS,
    REFERRAL_L1,
    REFERRAL_L2,
    /** Referral share with no entitled sponsor. */
    FALLBACK,
    WITHDRAWAL
}
