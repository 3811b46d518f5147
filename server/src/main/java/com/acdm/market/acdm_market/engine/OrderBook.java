package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.RoundPhase;
import com.acdm.market.acdm_market.events.OrderAdded;
import com.acdm.market.acdm_market.events.OrderRedeemed;
import com.acdm.market.acdm_market.events.OrderRemoved;
import com.acdm.market.acdm_market.exception.StateNotFoundException;
import com.acdm.market.acdm_market.exception.ValidationException;
import com.acdm.market.acdm_market.ledger.TokenLedger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Sell orders of the trade round.
 *
 * Posting an order escrows its tokens. Buyers redeem any part of an order at the
 * order's price; the seller is paid the trade value minus the referral shares of
 * the seller's own sponsor chain.
 */
@Slf4j
public class OrderBook {

    private final RoundController roundController;
    private final PricingEngine pricingEngine;
    private final RewardRouter rewardRouter;
    private final TokenLedger tokenLedger;

    public OrderBook(RoundController roundController, PricingEngine pricingEngine, RewardRouter rewardRouter,
            TokenLedger tokenLedger) {
        this.roundController = roundController;
        this.pricingEngine = pricingEngine;
        this.rewardRouter = rewardRouter;
        this.tokenLedger = tokenLedger;
    }

    public Order addOrder(MarketTransaction tx, BigInteger amount, BigInteger price) {
        roundController.requireActive(tx, RoundPhase.TRADE);
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Not valid price");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Not valid amount");
        }
        String owner = tx.caller();
        if (tokenLedger.balanceOf(owner).compareTo(amount) < 0) {
            throw new ValidationException("Not enough tokens");
        }

        tx.escrow(owner, amount);
        Order order = Order.builder()
                .id(tx.nextOrderId())
                .owner(owner)
                .pricePerToken(price)
                .amount(amount)
                .remainingAmount(amount)
                .createdAt(tx.now())
                .updatedAt(tx.now())
                .build();
        tx.putOrder(order);
        tx.emit(new OrderAdded(order.getId(), owner, amount, price));

        log.info("Order added: orderId={}, owner={}, amount={}, price={}", order.getId(), owner, amount, price);
        return order.copy();
    }

    /**
     * Cancel an order and give its unsold tokens back. Allowed in any phase.
     *
     * @return the amount returned to the owner
     */
    public BigInteger removeOrder(MarketTransaction tx, long orderId) {
        Order order = tx.findOrder(orderId)
                .orElseThrow(() -> new StateNotFoundException(orderId, "Not valid order id"));
        if (!order.getOwner().equals(tx.caller())) {
            throw new ValidationException("Not valid order id");
        }

        BigInteger returned = order.getRemainingAmount();
        if (returned.signum() > 0) {
            tx.release(order.getOwner(), returned);
        }
        tx.deleteOrder(orderId);
        tx.emit(new OrderRemoved(orderId, returned));

        log.info("Order removed: orderId={}, owner={}, returned={}", orderId, order.getOwner(), returned);
        return returned;
    }

    public OrderRedeemed redeemOrder(MarketTransaction tx, long orderId, BigInteger payment) {
        roundController.requireActive(tx, RoundPhase.TRADE);
        Order order = tx.findOrder(orderId)
                .filter(o -> !o.isFilled())
                .orElseThrow(() -> new StateNotFoundException(orderId, "Order doesn't exist or filled"));

        BigInteger price = order.getPricePerToken();
        BigInteger wanted = payment == null || payment.signum() <= 0
                ? BigInteger.ZERO
                : pricingEngine.tokensFor(payment, price);
        if (wanted.signum() == 0) {
            throw new ValidationException("Not enough ether to buy a token");
        }
        BigInteger granted = wanted.min(order.getRemainingAmount());
        BigInteger cost = pricingEngine.costFor(granted, price);
        if (cost.signum() == 0) {
            throw new ValidationException("Token amount is too small to be priced");
        }
        order.fill(granted, tx.now());

        String buyer = tx.caller();
        String seller = order.getOwner();
        tx.receive(payment);
        tx.release(buyer, granted);

        ReferralRewardConfig rates = tx.state().getRewardConfig();
        RewardSplit split = rewardRouter.split(tx, tx.state().getFallbackSink(), seller, cost,
                rates.l1Rate(RoundPhase.TRADE), rates.l2Rate(RoundPhase.TRADE));
        tx.pay(buyer, payment.subtract(cost), PayoutKind.REFUND);
        tx.pay(seller, split.getNet(), PayoutKind.SELLER_PROCEEDS);
        rewardRouter.route(tx, split);

        tx.round().setAccumulatedTradeVolume(tx.round().getAccumulatedTradeVolume().add(cost));

        OrderRedeemed event = new OrderRedeemed(orderId, buyer, granted, price);
        tx.emit(event);
        log.info("Order redeemed: orderId={}, buyer={}, seller={}, amount={}, cost={}, remaining={}",
                orderId, buyer, seller, granted, cost, order.getRemainingAmount());
        return event;
    }
}
