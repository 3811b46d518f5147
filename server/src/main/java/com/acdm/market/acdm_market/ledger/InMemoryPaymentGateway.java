package com.acdm.market.acdm_market.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local native currency book keeping what every recipient was sent.
 *
 * Recipients can register a hook that runs on receipt; a hook that throws makes
 * the send fail, the same way a reverting recipient would. Accounts can also be
 * marked as rejecting all payments.
 */
@Slf4j
public class InMemoryPaymentGateway implements PaymentGateway {

    private final Map<String, BigInteger> received = new ConcurrentHashMap<>();
    private final Map<String, Consumer<BigInteger>> hooks = new ConcurrentHashMap<>();
    private final Set<String> rejecting = ConcurrentHashMap.newKeySet();

    @Override
    public boolean send(String to, BigInteger amount) {
        if (to == null || amount == null || amount.signum() <= 0) {
            return false;
        }
        if (rejecting.contains(to)) {
            log.warn("Recipient {} rejected payment of {}", to, amount);
            return false;
        }
        Consumer<BigInteger> hook = hooks.get(to);
        if (hook != null) {
            try {
                hook.accept(amount);
            } catch (RuntimeException e) {
                log.warn("Recipient {} failed while receiving {}: {}", to, amount, e.getMessage());
                return false;
            }
        }
        received.merge(to, amount, BigInteger::add);
        return true;
    }

    @Override
    public boolean reclaim(String from, BigInteger amount) {
        if (from == null || amount == null || amount.signum() <= 0) {
            return false;
        }
        boolean[] reclaimed = {false};
        received.computeIfPresent(from, (account, balance) -> {
            if (balance.compareTo(amount) < 0) {
                return balance;
            }
            reclaimed[0] = true;
            return balance.subtract(amount);
        });
        if (!reclaimed[0]) {
            log.error("Cannot reclaim {} from {}: only {} was delivered", amount, from, receivedBy(from));
            return false;
        }
        log.info("Reclaimed {} from {}", amount, from);
        return true;
    }

    public BigInteger receivedBy(String account) {
        return received.getOrDefault(account, BigInteger.ZERO);
    }

    public void onReceive(String account, Consumer<BigInteger> hook) {
        hooks.put(account, hook);
    }

    public void rejectPaymentsTo(String account) {
        rejecting.add(account);
    }

    public void acceptPaymentsTo(String account) {
        rejecting.remove(account);
    }
}
