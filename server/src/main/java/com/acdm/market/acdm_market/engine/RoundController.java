package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.RoundPhase;
import com.acdm.market.acdm_market.events.RoundStarted;
import com.acdm.market.acdm_market.events.SaleTokenBought;
import com.acdm.market.acdm_market.exception.GuardReason;
import com.acdm.market.acdm_market.exception.GuardViolationException;
import com.acdm.market.acdm_market.exception.ValidationException;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Sale/trade round state machine.
 *
 * SALE → TRADE once the sale clock ran out or the whole batch is sold.
 * TRADE → SALE only once the trade clock ran out.
 */
@Slf4j
public class RoundController {

    private final PricingEngine pricingEngine;
    private final RewardRouter rewardRouter;

    public RoundController(PricingEngine pricingEngine, RewardRouter rewardRouter) {
        this.pricingEngine = pricingEngine;
        this.rewardRouter = rewardRouter;
    }

    public RoundStarted startSaleRound(MarketTransaction tx) {
        Round round = tx.round();
        if (round.getPhase() != RoundPhase.TRADE || !round.isExpired(tx.now())) {
            throw new GuardViolationException(GuardReason.INAPPROPRIATE_ROUND);
        }

        BigInteger price = pricingEngine.salePrice(round.getSaleRoundCount(), round.getSalePricePerToken());
        BigInteger amount = pricingEngine.tokensFor(round.getAccumulatedTradeVolume(), price);

        round.setPhase(RoundPhase.SALE);
        round.setSalePricePerToken(price);
        round.setSaleTokensRemaining(amount);
        round.setAccumulatedTradeVolume(BigInteger.ZERO);
        round.setEndTime(tx.now() + tx.state().getRoundDuration());
        round.setSaleRoundCount(round.getSaleRoundCount() + 1);

        if (amount.signum() > 0) {
            tx.mintToCustody(amount);
        }

        RoundStarted event = RoundStarted.sale(price, amount, round.getEndTime());
        tx.emit(event);
        log.info("Sale round {} started: price={}, amount={}, endTime={}",
                round.getSaleRoundCount(), price, amount, round.getEndTime());
        return event;
    }

    public SaleTokenBought buySaleTokens(MarketTransaction tx, BigInteger payment) {
        requireActive(tx, RoundPhase.SALE);
        Round round = tx.round();
        if (!round.hasInventory()) {
            throw new ValidationException("No tokens left");
        }
        BigInteger price = round.getSalePricePerToken();
        BigInteger wanted = payment == null || payment.signum() <= 0
                ? BigInteger.ZERO
                : pricingEngine.tokensFor(payment, price);
        if (wanted.signum() == 0) {
            throw new ValidationException("Not enough ether to buy a token");
        }

        BigInteger granted = wanted.min(round.getSaleTokensRemaining());
        BigInteger cost = pricingEngine.costFor(granted, price);
        if (cost.signum() == 0) {
            throw new ValidationException("Token amount is too small to be priced");
        }
        round.setSaleTokensRemaining(round.getSaleTokensRemaining().subtract(granted));

        String buyer = tx.caller();
        tx.receive(payment);
        tx.release(buyer, granted);
        tx.pay(buyer, payment.subtract(cost), PayoutKind.REFUND);

        ReferralRewardConfig rates = tx.state().getRewardConfig();
        RewardSplit split = rewardRouter.split(tx, tx.state().getFallbackSink(), buyer, cost,
                rates.l1Rate(RoundPhase.SALE), rates.l2Rate(RoundPhase.SALE));
        rewardRouter.route(tx, split);

        SaleTokenBought event = new SaleTokenBought(buyer, granted, cost);
        tx.emit(event);
        log.info("Sale tokens bought: buyer={}, amount={}, cost={}, referral={}, remaining={}",
                buyer, granted, cost, split.totalRewards(), round.getSaleTokensRemaining());
        return event;
    }

    public RoundStarted startTradeRound(MarketTransaction tx) {
        Round round = tx.round();
        if (round.getPhase() != RoundPhase.SALE || (!round.isExpired(tx.now()) && round.hasInventory())) {
            throw new GuardViolationException(GuardReason.INAPPROPRIATE_ROUND);
        }

        BigInteger unsold = round.getSaleTokensRemaining();
        if (unsold.signum() > 0) {
            tx.burnFromCustody(unsold);
            round.setSaleTokensRemaining(BigInteger.ZERO);
        }
        round.setPhase(RoundPhase.TRADE);
        round.setEndTime(tx.now() + tx.state().getRoundDuration());

        RoundStarted event = RoundStarted.trade(round.getEndTime());
        tx.emit(event);
        log.info("Trade round started: burned={}, endTime={}", unsold, round.getEndTime());
        return event;
    }

    /**
     * @throws GuardViolationException unless a round of {@code phase} is running and not expired
     */
    public void requireActive(MarketTransaction tx, RoundPhase phase) {
        if (!tx.round().isActive(phase, tx.now())) {
            throw new GuardViolationException(GuardReason.INAPPROPRIATE_ROUND);
        }
    }
}
