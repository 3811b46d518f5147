package com.acdm.market.acdm_market.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local token ledger. Used by the default wiring and by tests.
 */
@Slf4j
public class InMemoryTokenLedger implements TokenLedger {

    private final String custodyAccount;
    private final int decimals;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryTokenLedger(String custodyAccount, int decimals) {
        if (custodyAccount == null || custodyAccount.isBlank()) {
            throw new IllegalArgumentException("Custody account is required");
        }
        this.custodyAccount = custodyAccount;
        this.decimals = decimals;
    }

    @Override
    public synchronized void mint(String to, BigInteger amount) {
        requirePositive(amount);
        credit(to, amount);
        totalSupply = totalSupply.add(amount);
        log.debug("Minted {} to {}", amount, to);
    }

    @Override
    public synchronized void burn(String from, BigInteger amount) {
        requirePositive(amount);
        debit(from, amount);
        totalSupply = totalSupply.subtract(amount);
        log.debug("Burned {} from {}", amount, from);
    }

    @Override
    public synchronized void transfer(String to, BigInteger amount) {
        transferFrom(custodyAccount, to, amount);
    }

    @Override
    public synchronized void transferFrom(String from, String to, BigInteger amount) {
        requirePositive(amount);
        debit(from, amount);
        credit(to, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public int decimals() {
        return decimals;
    }

    /**
     * Set the balance of {@code account} to a previously persisted value. Only for
     * rebuilding the ledger at startup, before any call runs.
     */
    public synchronized void restoreBalance(String account, BigInteger balance) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("Restored balance must not be negative: " + balance);
        }
        if (account == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        BigInteger previous = balanceOf(account);
        balances.put(account, balance);
        totalSupply = totalSupply.subtract(previous).add(balance);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    public String getCustodyAccount() {
        return custodyAccount;
    }

    private void credit(String account, BigInteger amount) {
        if (account == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        balances.merge(account, amount, BigInteger::add);
    }

    private void debit(String account, BigInteger amount) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("Insufficient token balance: %s has %s, needs %s", account, balance, amount));
        }
        balances.put(account, balance.subtract(amount));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Token amount must be positive: " + amount);
        }
    }
}
