package com.acdm.market.acdm_market.entity;

/**
 * What happens to the second-level reward when the direct sponsor is the root.
 * The root is its own sponsor, so it would otherwise collect both levels.
 */
public enum RootL2Policy {

    /** The root receives the L1 and the L2 share. */
    PAY_ROOT,

    /** The L2 share is sent to the fallback sink instead. */
    FALLBACK_SINK
}
