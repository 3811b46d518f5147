package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralEdge;
import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.TokenBalance;
import com.acdm.market.acdm_market.events.MarketEvent;
import com.acdm.market.acdm_market.exception.TransferFailureException;
import com.acdm.market.acdm_market.ledger.PaymentGateway;
import com.acdm.market.acdm_market.ledger.TokenLedger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit of work of a single engine call.
 *
 * State changes are staged on copies and only become visible when the engine
 * commits. Token ledger calls are applied immediately and each one records its
 * inverse, so an aborted call can put the ledger back. Native payments are
 * queued and sent in {@link #settle} after all other work succeeded; every
 * delivered payment records a reclaim, so a later refused send takes back the
 * earlier ones too.
 */
@Slf4j
public class MarketTransaction implements ReferralGraph {

    private final MarketContext context;
    private final TokenLedger ledger;
    private final String caller;
    private final long now;
    private final MarketState state;

    private final Map<Long, Order> stagedOrders = new LinkedHashMap<>();
    private final Set<Long> removedOrderIds = new LinkedHashSet<>();
    private final Map<String, ReferralEdge> newEdges = new LinkedHashMap<>();
    private final Set<String> touchedAccounts = new LinkedHashSet<>();
    private final Deque<Runnable> compensations = new ArrayDeque<>();
    private final List<Payout> payouts = new ArrayList<>();
    private final List<MarketEvent> events = new ArrayList<>();

    MarketTransaction(MarketContext context, TokenLedger ledger, String caller, long now) {
        this.context = context;
        this.ledger = ledger;
        this.caller = caller;
        this.now = now;
        this.state = context.state().copy();
    }

    public String caller() {
        return caller;
    }

    /**
     * Epoch seconds at which the call executes.
     */
    public long now() {
        return now;
    }

    public MarketState state() {
        return state;
    }

    public Round round() {
        return state.getRound();
    }

    public String custodyAccount() {
        return context.custodyAccount();
    }

    // ===== Orders =====

    /**
     * Staged copy of an order. Changes to the returned object are committed with the call.
     */
    public Optional<Order> findOrder(long orderId) {
        if (removedOrderIds.contains(orderId)) {
            return Optional.empty();
        }
        Order staged = stagedOrders.get(orderId);
        if (staged != null) {
            return Optional.of(staged);
        }
        Optional<Order> committed = context.order(orderId).map(Order::copy);
        committed.ifPresent(order -> stagedOrders.put(orderId, order));
        return committed;
    }

    public long nextOrderId() {
        long id = state.getLastOrderId() + 1;
        state.setLastOrderId(id);
        return id;
    }

    public void putOrder(Order order) {
        removedOrderIds.remove(order.getId());
        stagedOrders.put(order.getId(), order);
    }

    public void deleteOrder(long orderId) {
        stagedOrders.remove(orderId);
        removedOrderIds.add(orderId);
    }

    // ===== Referral graph =====

    @Override
    public Optional<String> sponsorOf(String account) {
        if (account == null) {
            return Optional.empty();
        }
        ReferralEdge staged = newEdges.get(account);
        if (staged != null) {
            return Optional.of(staged.getSponsor());
        }
        return context.sponsorOf(account);
    }

    @Override
    public String rootAccount() {
        return context.rootAccount();
    }

    public void addEdge(ReferralEdge edge) {
        newEdges.put(edge.getReferee(), edge);
    }

    // ===== Token ledger =====

    public void mintToCustody(BigInteger amount) {
        String custody = custodyAccount();
        ledger.mint(custody, amount);
        touchedAccounts.add(custody);
        compensations.push(() -> ledger.burn(custody, amount));
    }

    public void burnFromCustody(BigInteger amount) {
        String custody = custodyAccount();
        ledger.burn(custody, amount);
        touchedAccounts.add(custody);
        compensations.push(() -> ledger.mint(custody, amount));
    }

    /**
     * Move tokens from custody to {@code to}.
     */
    public void release(String to, BigInteger amount) {
        ledger.transfer(to, amount);
        touchedAccounts.add(custodyAccount());
        touchedAccounts.add(to);
        compensations.push(() -> ledger.transferFrom(to, custodyAccount(), amount));
    }

    /**
     * Move tokens from {@code from} into custody.
     */
    public void escrow(String from, BigInteger amount) {
        ledger.transferFrom(from, custodyAccount(), amount);
        touchedAccounts.add(from);
        touchedAccounts.add(custodyAccount());
        compensations.push(() -> ledger.transfer(from, amount));
    }

    // ===== Native currency =====

    /**
     * Native currency that came in with the call.
     */
    public void receive(BigInteger amount) {
        state.setNativeBalance(state.getNativeBalance().add(amount));
    }

    /**
     * Queue a native payment out of the engine. Zero amounts are dropped.
     */
    public void pay(String recipient, BigInteger amount, PayoutKind kind) {
        if (amount.signum() == 0) {
            return;
        }
        if (amount.signum() < 0) {
            throw new IllegalStateException(String.format("Negative %s payout of %s to %s", kind, amount, recipient));
        }
        BigInteger remaining = state.getNativeBalance().subtract(amount);
        if (remaining.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Payout of %s exceeds engine balance %s", amount, state.getNativeBalance()));
        }
        state.setNativeBalance(remaining);
        payouts.add(new Payout(recipient, amount, kind));
    }

    public void emit(MarketEvent event) {
        events.add(event);
    }

    /**
     * Send all queued payments in order. The first refused send aborts the call.
     */
    void settle(PaymentGateway gateway) {
        for (Payout payout : payouts) {
            String recipient = payout.getRecipient();
            BigInteger amount = payout.getAmount();
            if (!gateway.send(recipient, amount)) {
                log.error("Payment refused: kind={}, recipient={}, amount={}", payout.getKind(), recipient, amount);
                throw new TransferFailureException(recipient, amount);
            }
            compensations.push(() -> {
                if (!gateway.reclaim(recipient, amount)) {
                    throw new IllegalStateException(String.format(
                        "Could not reclaim %s payment of %s from %s", payout.getKind(), amount, recipient));
                }
            });
        }
    }

    /**
     * Undo delivered payments and applied ledger calls, newest first. Failures of the undo are attached to {@code cause}.
     */
    void rollback(Throwable cause) {
        while (!compensations.isEmpty()) {
            Runnable compensation = compensations.pop();
            try {
                compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation failed while aborting call of {}: {}", caller, e.getMessage(), e);
                cause.addSuppressed(e);
            }
        }
    }

    Collection<Order> stagedOrders() {
        return Collections.unmodifiableCollection(stagedOrders.values());
    }

    Set<Long> removedOrderIds() {
        return Collections.unmodifiableSet(removedOrderIds);
    }

    Collection<ReferralEdge> newEdges() {
        return Collections.unmodifiableCollection(newEdges.values());
    }

    /**
     * Current ledger balances of every account this call moved tokens for.
     */
    List<TokenBalance> touchedBalances() {
        List<TokenBalance> balances = new ArrayList<>();
        for (String account : touchedAccounts) {
            balances.add(TokenBalance.builder()
                    .account(account)
                    .balance(ledger.balanceOf(account))
                    .updatedAt(now)
                    .build());
        }
        return balances;
    }

    List<MarketEvent> events() {
        return Collections.unmodifiableList(events);
    }

    List<Payout> payouts() {
        return Collections.unmodifiableList(payouts);
    }
}
