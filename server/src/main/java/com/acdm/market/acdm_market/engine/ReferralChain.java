package com.acdm.market.acdm_market.engine;

import lombok.Value;

/**
 * Up to two sponsors above a principal. l2 is present whenever l1 is, because a
 * sponsor can only be named once it is registered itself.
 */
@Value
public class ReferralChain {

    private static final ReferralChain NONE = new ReferralChain(null, null);

    String l1;
    String l2;

    public static ReferralChain none() {
        return NONE;
    }

    public static ReferralChain of(String l1, String l2) {
        return new ReferralChain(l1, l2);
    }

    public boolean isEmpty() {
        return l1 == null;
    }
}
