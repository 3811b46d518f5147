package com.acdm.market.acdm_market.ledger;

import java.math.BigInteger;

/**
 * The fungible token the market issues and trades.
 *
 * The ledger is bound to the engine's custody account: {@link #transfer} always
 * moves tokens out of custody. Implementations throw on any failure
 * (insufficient balance, unknown account); they never partially apply a call.
 */
public interface TokenLedger {

    void mint(String to, BigInteger amount);

    void burn(String from, BigInteger amount);

    /**
     * Move tokens from the engine's custody account to {@code to}.
     */
    void transfer(String to, BigInteger amount);

    void transferFrom(String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);

    int decimals();
}
