package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.events.MarketEvent;
import com.acdm.market.acdm_market.events.ReferralRewardPaid;
import com.acdm.market.acdm_market.events.RoundStarted;
import com.acdm.market.acdm_market.events.SaleTokenBought;
import com.acdm.market.acdm_market.exception.GuardReason;
import com.acdm.market.acdm_market.exception.GuardViolationException;
import com.acdm.market.acdm_market.exception.MarketException;
import com.acdm.market.acdm_market.exception.TransferFailureException;
import com.acdm.market.acdm_market.exception.ValidationException;
import com.acdm.market.acdm_market.ledger.InMemoryTokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.acdm.market.acdm_market.engine.MarketFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class MarketEngineTest {

    private MarketFixture market;

    @BeforeEach
    void setUp() {
        market = new MarketFixture();
    }

    @Test
    void refusedPaymentRollsBackTheWholePurchase() {
        market.engine.startSaleRound("alice");
        market.published.clear();
        market.commits.clear();
        market.gateway.rejectPaymentsTo(SINK);

        TransferFailureException e = assertThrows(TransferFailureException.class,
                () -> market.engine.buySaleTokens("alice", units("100000000000000000")));

        assertEquals(SINK, e.getRecipient());
        assertEquals(BigInteger.ZERO, market.ledger.balanceOf("alice"));
        assertEquals(units("100000000000"), market.ledger.balanceOf(CUSTODY));
        assertEquals(units("100000000000"), market.engine.getRound().getSaleTokensRemaining());
        assertEquals(BigInteger.ZERO, market.engine.getNativeBalance());
        assertTrue(market.published.isEmpty());
        assertTrue(market.commits.isEmpty());

        market.gateway.acceptPaymentsTo(SINK);
        assertEquals(units("10000000000"),
                market.engine.buySaleTokens("alice", units("100000000000000000")).getAmount());
    }

    @Test
    void refusedSellerProceedsRestoreTheOrderAndEscrow() {
        market.buyInFirstSale("alice", units("100000000000000000"));
        market.openTradeRound();
        long orderId = market.engine.addOrder("alice", units("1000000000"), units("20000000000000")).getId();
        market.gateway.rejectPaymentsTo("alice");

        assertThrows(TransferFailureException.class,
                () -> market.engine.redeemOrder("bob", orderId, units("5000000000000000")));

        assertEquals(units("1000000000"), market.engine.findOrder(orderId).get().getRemainingAmount());
        assertEquals(units("1000000000"), market.ledger.balanceOf(CUSTODY));
        assertEquals(BigInteger.ZERO, market.ledger.balanceOf("bob"));
        assertEquals(BigInteger.ZERO, market.engine.getRound().getAccumulatedTradeVolume());
    }

    @Test
    void refundAlreadySentIsReclaimedWhenTheSellerRefusesProceeds() {
        market.buyInFirstSale("alice", units("100000000000000000"));
        market.openTradeRound();
        long orderId = market.engine.addOrder("alice", units("1000000000"), units("20000000000000")).getId();
        BigInteger balanceBefore = market.engine.getNativeBalance();
        market.gateway.rejectPaymentsTo("alice");

        // 1 native for an order worth 0.02: the 0.98 refund goes out before the seller's proceeds
        TransferFailureException e = assertThrows(TransferFailureException.class,
                () -> market.engine.redeemOrder("bob", orderId, units("1000000000000000000")));

        assertEquals("alice", e.getRecipient());
        assertEquals(BigInteger.ZERO, market.gateway.receivedBy("bob"));
        assertEquals(BigInteger.ZERO, market.ledger.balanceOf("bob"));
        assertEquals(balanceBefore, market.engine.getNativeBalance());
        assertEquals(units("1000000000"), market.engine.findOrder(orderId).get().getRemainingAmount());

        market.gateway.acceptPaymentsTo("alice");
        market.engine.redeemOrder("bob", orderId, units("1000000000000000000"));
        assertEquals(units("980000000000000000"), market.gateway.receivedBy("bob"));
        assertEquals(units("1000000000"), market.ledger.balanceOf("bob"));
    }

    @Test
    void recipientReenteringTheEngineIsRejected() {
        market.engine.startSaleRound("alice");
        AtomicReference<MarketException> reentry = new AtomicReference<>();
        market.gateway.onReceive("alice", amount -> {
            try {
                market.engine.startTradeRound("alice");
            } catch (MarketException e) {
                reentry.set(e);
            }
        });

        // the refund reaches alice while the purchase is still executing
        market.engine.buySaleTokens("alice", units("2000000000000000000"));

        GuardViolationException rejected = assertInstanceOf(GuardViolationException.class, reentry.get());
        assertEquals(GuardReason.REENTRANT_CALL, rejected.getGuardReason());
        assertEquals("ReentrantCall", rejected.getReason());
        assertEquals(units("100000000000"), market.ledger.balanceOf("alice"));
    }

    @Test
    void failingReentrantRecipientAbortsTheOuterCall() {
        market.engine.startSaleRound("alice");
        market.gateway.onReceive("alice", amount -> market.engine.startTradeRound("alice"));

        assertThrows(TransferFailureException.class,
                () -> market.engine.buySaleTokens("alice", units("2000000000000000000")));
        assertEquals(BigInteger.ZERO, market.ledger.balanceOf("alice"));

        // guard is released after the aborted call
        market.gateway.onReceive("alice", amount -> { });
        market.engine.buySaleTokens("alice", units("100000000000000000"));
        assertEquals(units("10000000000"), market.ledger.balanceOf("alice"));
    }

    @Test
    void eventsArePublishedAfterTheCommitInEmitOrder() {
        market.engine.register("bob", ROOT);
        market.engine.startSaleRound("bob");
        AtomicReference<Round> seenByListener = new AtomicReference<>();
        market.published.clear();
        List<MarketEvent> published = market.published;
        MarketEngine engine = market.engine;
        engine.addCommitListener(commit -> seenByListener.set(engine.getRound()));

        engine.buySaleTokens("bob", units("100000000000000000"));

        assertEquals(units("90000000000"), seenByListener.get().getSaleTokensRemaining());
        assertEquals(3, published.size());
        assertEquals(ReferralRewardPaid.class, published.get(0).getClass());
        assertEquals(ReferralRewardPaid.class, published.get(1).getClass());
        assertEquals(SaleTokenBought.class, published.get(2).getClass());
    }

    @Test
    void commitCarriesTheChangedRecords() {
        market.engine.register("bob", ROOT);
        MarketCommit registration = market.commits.get(market.commits.size() - 1);
        assertEquals("register", registration.getOperation());
        assertEquals("bob", registration.getCaller());
        assertEquals(1, registration.getNewEdges().size());

        market.buyInFirstSale("alice", units("100000000000000000"));
        market.openTradeRound();
        long orderId = market.engine.addOrder("alice", units("1000000000"), units("20000000000000")).getId();
        market.engine.removeOrder("alice", orderId);

        MarketCommit removal = market.commits.get(market.commits.size() - 1);
        assertEquals(List.of(orderId), removal.getRemovedOrderIds());
        assertTrue(removal.getSavedOrders().isEmpty());
        assertEquals(market.clock.epochSecond(), removal.getState().getLastCommittedAt());
    }

    @Test
    void restartedMarketStillBacksEscrowedOrdersWithCustody() {
        market.buyInFirstSale("alice", units("100000000000000000"));
        market.openTradeRound();
        long orderId = market.engine.addOrder("alice", units("1000000000"), units("20000000000000")).getId();
        long filledId = market.engine.addOrder("alice", units("500000000"), units("20000000000000")).getId();
        market.engine.redeemOrder("bob", filledId, units("10000000000000000"));

        InMemoryTokenLedger restoredLedger = new InMemoryTokenLedger(CUSTODY, DECIMALS);
        MarketEngine restarted = market.restartFromCommits(restoredLedger);

        assertEquals(market.ledger.balanceOf(CUSTODY), restoredLedger.balanceOf(CUSTODY));
        assertEquals(market.ledger.balanceOf("alice"), restoredLedger.balanceOf("alice"));
        assertEquals(units("500000000"), restoredLedger.balanceOf("bob"));

        restarted.redeemOrder("bob", orderId, units("2000000000000000"));
        assertEquals(units("900000000"), restarted.removeOrder("alice", orderId));
        assertEquals(units("600000000"), restoredLedger.balanceOf("bob"));
        assertEquals(BigInteger.ZERO, restoredLedger.balanceOf(CUSTODY));
    }

    @Test
    void failingListenersDoNotUndoACommittedCall() {
        market.engine.addCommitListener(commit -> {
            throw new IllegalStateException("store down");
        });

        RoundStarted started = market.engine.startSaleRound("alice");

        assertEquals(started.getAmount(), market.engine.getRound().getSaleTokensRemaining());
        assertEquals(1, market.published(RoundStarted.class).size());
    }

    @Test
    void callsNeedACaller() {
        assertThrows(ValidationException.class, () -> market.engine.startSaleRound(null));
        assertThrows(ValidationException.class, () -> market.engine.register(" ", ROOT));
    }

    @Test
    void viewsReturnCopies() {
        Round round = market.engine.getRound();
        round.setSaleTokensRemaining(BigInteger.TEN);

        assertEquals(BigInteger.ZERO, market.engine.getRound().getSaleTokensRemaining());
    }
}
