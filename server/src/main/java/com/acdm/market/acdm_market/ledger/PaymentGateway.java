package com.acdm.market.acdm_market.ledger;

import java.math.BigInteger;

/**
 * Native-currency send primitive.
 *
 * The recipient may run arbitrary code while receiving, including calls back
 * into the market engine. The result must always be checked.
 *
 * Payments delivered during a call that later aborts are taken back with
 * {@link #reclaim}, newest first.
 */
public interface PaymentGateway {

    /**
     * @return true if {@code amount} was delivered to {@code to}
     */
    boolean send(String to, BigInteger amount);

    /**
     * Take back {@code amount} previously delivered to {@code from} by {@link #send}.
     * Does not notify the recipient.
     *
     * @return true if the full amount was taken back
     */
    boolean reclaim(String from, BigInteger amount);
}
