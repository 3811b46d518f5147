package com.acdm.market.acdm_market.engine;

import java.util.Optional;

/**
 * Read access to referee → sponsor edges.
 */
public interface ReferralGraph {

    Optional<String> sponsorOf(String account);

    /**
     * The pre-seeded account that is its own sponsor.
     */
    String rootAccount();
}
