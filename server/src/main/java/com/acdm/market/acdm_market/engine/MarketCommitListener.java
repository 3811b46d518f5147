package com.acdm.market.acdm_market.engine;

@FunctionalInterface
public interface MarketCommitListener {

    void onCommit(MarketCommit commit);
}
