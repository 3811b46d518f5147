package com.acdm.market.acdm_market.cache;

import com.acdm.market.acdm_market.engine.MarketCommit;
import com.acdm.market.acdm_market.engine.MarketCommitListener;
import com.acdm.market.acdm_market.engine.MarketContext;
import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralEdge;
import com.acdm.market.acdm_market.entity.TokenBalance;
import com.acdm.market.acdm_market.ledger.InMemoryTokenLedger;
import com.acdm.market.acdm_market.repositories.MarketStateRepository;
import com.acdm.market.acdm_market.repositories.OrderRepository;
import com.acdm.market.acdm_market.repositories.ReferralEdgeRepository;
import com.acdm.market.acdm_market.repositories.TokenBalanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable copy of the market context in MongoDB.
 *
 * The engine keeps the authoritative state in memory; every committed call is
 * written behind it on the thread that committed it, so writes keep commit order.
 * A failed write is logged and does not undo the call.
 *
 * Token balances of the process-local ledger are stored alongside, so escrowed
 * orders and unsold sale inventory are still backed by custody after a restart.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketStore implements MarketCommitListener {

    private final MarketStateRepository marketStateRepository;
    private final OrderRepository orderRepository;
    private final ReferralEdgeRepository referralEdgeRepository;
    private final TokenBalanceRepository tokenBalanceRepository;

    /**
     * Rebuild the context from the database, or create and persist a new one.
     */
    public MarketContext loadOrCreate(String rootAccount, String custodyAccount, Supplier<MarketContext> genesis) {
        Optional<MarketState> stored = marketStateRepository.findById(MarketState.SINGLETON_ID);
        if (stored.isEmpty()) {
            MarketContext context = genesis.get();
            marketStateRepository.save(context.state().copy());
            log.info("No stored market state found, created genesis state");
            return context;
        }

        List<Order> orders = orderRepository.findAll();
        List<ReferralEdge> edges = referralEdgeRepository.findAll();
        MarketState state = stored.get();
        log.info("Restored market state: phase={}, endTime={}, orders={}, referrals={}",
                state.getRound().getPhase(), state.getRound().getEndTime(), orders.size(), edges.size());
        return MarketContext.restore(rootAccount, custodyAccount, state, orders, edges);
    }

    /**
     * Load the stored token balances into {@code ledger} and check that custody
     * covers everything {@code context} says it holds.
     *
     * @throws IllegalStateException if custody holds fewer tokens than open orders and sale inventory need
     */
    public void restoreLedger(InMemoryTokenLedger ledger, MarketContext context) {
        List<TokenBalance> balances = tokenBalanceRepository.findAll();
        balances.forEach(balance -> ledger.restoreBalance(balance.getAccount(), balance.getBalance()));

        BigInteger required = context.requiredCustodyBalance();
        BigInteger held = ledger.balanceOf(context.custodyAccount());
        if (held.compareTo(required) < 0) {
            log.error("Custody account {} holds {} tokens, open orders and sale inventory need {}",
                    context.custodyAccount(), held, required);
            throw new IllegalStateException(String.format(
                "Stored token balances do not cover the market: custody holds %s, needs %s", held, required));
        }
        log.info("Restored token balances: accounts={}, custody={}", balances.size(), held);
    }

    @Override
    public void onCommit(MarketCommit commit) {
        try {
            marketStateRepository.save(commit.getState());
            if (!commit.getSavedOrders().isEmpty()) {
                orderRepository.saveAll(commit.getSavedOrders());
            }
            if (!commit.getRemovedOrderIds().isEmpty()) {
                orderRepository.deleteAllById(commit.getRemovedOrderIds());
            }
            if (!commit.getNewEdges().isEmpty()) {
                referralEdgeRepository.saveAll(commit.getNewEdges());
            }
            if (!commit.getBalances().isEmpty()) {
                tokenBalanceRepository.saveAll(commit.getBalances());
            }
            log.debug("Persisted commit: operation={}, orders={}, removed={}, edges={}, balances={}",
                    commit.getOperation(), commit.getSavedOrders().size(),
                    commit.getRemovedOrderIds().size(), commit.getNewEdges().size(), commit.getBalances().size());
        } catch (Exception e) {
            log.error("Failed to persist commit: operation={}", commit.getOperation(), e);
        }
    }
}
