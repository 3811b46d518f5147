package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralEdge;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Committed state of the market: the scalar {@link MarketState}, the order table
 * and the referral graph.
 *
 * Only {@link MarketEngine} mutates a context, and only by committing a
 * {@link MarketTransaction}. Not thread-safe on its own.
 */
public class MarketContext implements ReferralGraph {

    private final String rootAccount;
    private final String custodyAccount;
    private MarketState state;
    private final NavigableMap<Long, Order> orders = new TreeMap<>();
    private final Map<String, ReferralEdge> edges = new HashMap<>();

    private MarketContext(String rootAccount, String custodyAccount, MarketState state) {
        if (rootAccount == null || rootAccount.isBlank()) {
            throw new IllegalArgumentException("Root account is required");
        }
        if (custodyAccount == null || custodyAccount.isBlank()) {
            throw new IllegalArgumentException("Custody account is required");
        }
        this.rootAccount = rootAccount;
        this.custodyAccount = custodyAccount;
        this.state = state;
    }

    /**
     * Fresh market: the given state plus a referral graph holding only the root, sponsored by itself.
     */
    public static MarketContext genesis(String rootAccount, String custodyAccount, MarketState initialState, long now) {
        MarketContext context = new MarketContext(rootAccount, custodyAccount, initialState);
        context.edges.put(rootAccount, ReferralEdge.builder()
                .referee(rootAccount)
                .sponsor(rootAccount)
                .registeredAt(now)
                .build());
        return context;
    }

    /**
     * Rebuild a context from persisted records.
     */
    public static MarketContext restore(String rootAccount, String custodyAccount, MarketState state,
            Collection<Order> orders, Collection<ReferralEdge> edges) {
        MarketContext context = new MarketContext(rootAccount, custodyAccount, state);
        orders.forEach(order -> context.orders.put(order.getId(), order));
        edges.forEach(edge -> context.edges.put(edge.getReferee(), edge));
        context.edges.putIfAbsent(rootAccount, ReferralEdge.builder()
                .referee(rootAccount)
                .sponsor(rootAccount)
                .registeredAt(state.getLastCommittedAt())
                .build());
        return context;
    }

    @Override
    public Optional<String> sponsorOf(String account) {
        if (account == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(edges.get(account)).map(ReferralEdge::getSponsor);
    }

    @Override
    public String rootAccount() {
        return rootAccount;
    }

    public String custodyAccount() {
        return custodyAccount;
    }

    public MarketState state() {
        return state;
    }

    /**
     * Committed order, not a copy. Callers outside the engine get copies from {@link MarketEngine}.
     */
    Optional<Order> order(long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    List<Order> ordersMatching(Predicate<Order> filter) {
        return orders.values().stream()
                .filter(filter)
                .map(Order::copy)
                .collect(Collectors.toList());
    }

    /**
     * Tokens the custody account has to hold: the unsold sale inventory plus
     * whatever open orders still escrow.
     */
    public BigInteger requiredCustodyBalance() {
        BigInteger escrowed = orders.values().stream()
                .map(Order::getRemainingAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
        return state.getRound().getSaleTokensRemaining().add(escrowed);
    }

    MarketCommit apply(MarketTransaction tx, String operation) {
        tx.state().setLastCommittedAt(tx.now());
        this.state = tx.state();

        List<Order> saved = new ArrayList<>();
        for (Order order : tx.stagedOrders()) {
            orders.put(order.getId(), order);
            saved.add(order.copy());
        }
        tx.removedOrderIds().forEach(orders::remove);
        tx.newEdges().forEach(edge -> edges.put(edge.getReferee(), edge));

        return MarketCommit.builder()
                .operation(operation)
                .caller(tx.caller())
                .state(state.copy())
                .savedOrders(saved)
                .removedOrderIds(new ArrayList<>(tx.removedOrderIds()))
                .newEdges(new ArrayList<>(tx.newEdges()))
                .balances(tx.touchedBalances())
                .events(new ArrayList<>(tx.events()))
                .build();
    }
}
