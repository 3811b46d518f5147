package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.Role;
import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.RoundPhase;
import com.acdm.market.acdm_market.events.MarketEvent;
import com.acdm.market.acdm_market.events.MarketEventPublisher;
import com.acdm.market.acdm_market.events.OrderRedeemed;
import com.acdm.market.acdm_market.events.RoundStarted;
import com.acdm.market.acdm_market.events.SaleTokenBought;
import com.acdm.market.acdm_market.exception.GuardReason;
import com.acdm.market.acdm_market.exception.GuardViolationException;
import com.acdm.market.acdm_market.exception.MarketException;
import com.acdm.market.acdm_market.exception.ValidationException;
import com.acdm.market.acdm_market.ledger.PaymentGateway;
import com.acdm.market.acdm_market.ledger.TokenLedger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point of the market. Every call:
 * 1. is rejected if another call is still executing (reentrancy guard)
 * 2. runs against a {@link MarketTransaction} staged over the committed context
 * 3. sends its queued payments
 * 4. commits, then notifies commit listeners and publishes its events
 *
 * An exception at any step before the commit rolls the call back completely.
 */
@Slf4j
public class MarketEngine {

    private final MarketContext context;
    private final TokenLedger tokenLedger;
    private final PaymentGateway paymentGateway;
    private final Clock clock;

    private final RoundController roundController;
    private final OrderBook orderBook;
    private final ReferralRegistry referralRegistry;
    private final MarketAdmin marketAdmin;

    private final MarketEventPublisher eventPublisher;
    private final List<MarketCommitListener> commitListeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private boolean callInProgress;

    public MarketEngine(MarketContext context, TokenLedger tokenLedger, PaymentGateway paymentGateway, Clock clock,
            RoundController roundController, OrderBook orderBook, ReferralRegistry referralRegistry,
            MarketAdmin marketAdmin, MarketEventPublisher eventPublisher) {
        this.context = context;
        this.tokenLedger = tokenLedger;
        this.paymentGateway = paymentGateway;
        this.clock = clock;
        this.roundController = roundController;
        this.orderBook = orderBook;
        this.referralRegistry = referralRegistry;
        this.marketAdmin = marketAdmin;
        this.eventPublisher = eventPublisher;
    }

    public void addCommitListener(MarketCommitListener listener) {
        commitListeners.add(listener);
    }

    // ===== Rounds =====

    public RoundStarted startSaleRound(String caller) {
        return execute(caller, "startSaleRound", roundController::startSaleRound);
    }

    public SaleTokenBought buySaleTokens(String caller, BigInteger payment) {
        return execute(caller, "buySaleTokens", tx -> roundController.buySaleTokens(tx, payment));
    }

    public RoundStarted startTradeRound(String caller) {
        return execute(caller, "startTradeRound", roundController::startTradeRound);
    }

    // ===== Orders =====

    public Order addOrder(String caller, BigInteger amount, BigInteger price) {
        return execute(caller, "addOrder", tx -> orderBook.addOrder(tx, amount, price));
    }

    public BigInteger removeOrder(String caller, long orderId) {
        return execute(caller, "removeOrder", tx -> orderBook.removeOrder(tx, orderId));
    }

    public OrderRedeemed redeemOrder(String caller, long orderId, BigInteger payment) {
        return execute(caller, "redeemOrder", tx -> orderBook.redeemOrder(tx, orderId, payment));
    }

    // ===== Referrals =====

    public void register(String caller, String sponsor) {
        execute(caller, "register", tx -> referralRegistry.register(tx, sponsor));
    }

    // ===== Administration =====

    public BigInteger withdrawFunds(String caller, String recipient, BigInteger amount) {
        return execute(caller, "withdrawFunds", tx -> marketAdmin.withdrawFunds(tx, recipient, amount));
    }

    public ReferralRewardConfig updateReferralRates(String caller, RoundPhase phase, int l1Rate, int l2Rate) {
        return execute(caller, "updateReferralRates", tx -> marketAdmin.updateReferralRates(tx, phase, l1Rate, l2Rate));
    }

    public long updateRoundDuration(String caller, long seconds) {
        return execute(caller, "updateRoundDuration", tx -> marketAdmin.updateRoundDuration(tx, seconds));
    }

    public String updateFallbackSink(String caller, String fallbackSink) {
        return execute(caller, "updateFallbackSink", tx -> marketAdmin.updateFallbackSink(tx, fallbackSink));
    }

    public boolean grantRole(String caller, Role role, String account) {
        return execute(caller, "grantRole", tx -> marketAdmin.grantRole(tx, role, account));
    }

    public boolean revokeRole(String caller, Role role, String account) {
        return execute(caller, "revokeRole", tx -> marketAdmin.revokeRole(tx, role, account));
    }

    // ===== Views =====

    public Round getRound() {
        return read(() -> context.state().getRound().copy());
    }

    /**
     * True while the current round accepts calls of its phase.
     */
    public boolean isRoundActive() {
        return read(() -> !context.state().getRound().isExpired(now()));
    }

    public Optional<Order> findOrder(long orderId) {
        return read(() -> context.order(orderId).map(Order::copy));
    }

    /**
     * Orders that still have tokens to sell, by ascending id.
     */
    public List<Order> openOrders() {
        return read(() -> context.ordersMatching(order -> !order.isFilled()));
    }

    public List<Order> ordersOf(String owner) {
        return read(() -> context.ordersMatching(order -> order.getOwner().equals(owner)));
    }

    public Optional<String> sponsorOf(String account) {
        return read(() -> context.sponsorOf(account));
    }

    public ReferralRewardConfig getRewardConfig() {
        return read(() -> context.state().getRewardConfig());
    }

    public BigInteger getNativeBalance() {
        return read(() -> context.state().getNativeBalance());
    }

    public long getRoundDuration() {
        return read(() -> context.state().getRoundDuration());
    }

    public String getFallbackSink() {
        return read(() -> context.state().getFallbackSink());
    }

    public boolean hasRole(Role role, String account) {
        return read(() -> context.state().hasRole(role, account));
    }

    public String getRootAccount() {
        return context.rootAccount();
    }

    public String getCustodyAccount() {
        return context.custodyAccount();
    }

    public int getTokenDecimals() {
        return tokenLedger.decimals();
    }

    // ===== Execution =====

    private <T> T execute(String caller, String operation, Function<MarketTransaction, T> body) {
        lock.lock();
        try {
            if (callInProgress) {
                log.warn("Reentrant call rejected: operation={}, caller={}", operation, caller);
                throw new GuardViolationException(GuardReason.REENTRANT_CALL);
            }
            callInProgress = true;
            try {
                return run(caller, operation, body);
            } finally {
                callInProgress = false;
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> T run(String caller, String operation, Function<MarketTransaction, T> body) {
        if (caller == null || caller.isBlank()) {
            throw new ValidationException("Caller is required");
        }
        MarketTransaction tx = new MarketTransaction(context, tokenLedger, caller, now());
        T result;
        try {
            result = body.apply(tx);
            tx.settle(paymentGateway);
        } catch (MarketException e) {
            tx.rollback(e);
            log.warn("Call rejected: operation={}, caller={}, reason={}, message={}",
                    operation, caller, e.getReason(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            tx.rollback(e);
            log.error("Call failed: operation={}, caller={}, error={}", operation, caller, e.getMessage(), e);
            throw e;
        }

        MarketCommit commit = context.apply(tx, operation);
        notifyCommitted(commit);
        return result;
    }

    private void notifyCommitted(MarketCommit commit) {
        for (MarketCommitListener listener : commitListeners) {
            try {
                listener.onCommit(commit);
            } catch (RuntimeException e) {
                log.error("Commit listener failed: operation={}, error={}", commit.getOperation(), e.getMessage(), e);
            }
        }
        for (MarketEvent event : commit.getEvents()) {
            try {
                eventPublisher.publish(event);
            } catch (RuntimeException e) {
                log.error("Event publishing failed: event={}, error={}", event, e.getMessage(), e);
            }
        }
    }

    private <T> T read(Supplier<T> view) {
        lock.lock();
        try {
            return view.get();
        } finally {
            lock.unlock();
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
