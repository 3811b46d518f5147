package com.acdm.market.acdm_market.events;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.acdm.market.acdm_market.entity.Units;

import lombok.extern.slf4j.Slf4j;

/**
 * Audit log of every committed market event.
 */
@Slf4j
@Component
public class MarketEventLogger {

    @EventListener
    public void onRoundStarted(RoundStarted event) {
        if (event.getPrice() != null) {
            log.info("[EVENT] RoundStarted phase={} price={} amount={} endTime={}",
                    event.getPhase(), Units.formatNative(event.getPrice()), event.getAmount(), event.getEndTime());
        } else {
            log.info("[EVENT] RoundStarted phase={} endTime={}", event.getPhase(), event.getEndTime());
        }
    }

    @EventListener
    public void onSaleTokenBought(SaleTokenBought event) {
        log.info("[EVENT] SaleTokenBought buyer={} amount={} cost={}",
                event.getBuyer(), event.getAmount(), Units.formatNative(event.getCost()));
    }

    @EventListener
    public void onOrderRedeemed(OrderRedeemed event) {
        log.info("[EVENT] OrderRedeemed orderId={} buyer={} amount={} price={}",
                event.getOrderId(), event.getBuyer(), event.getAmount(), Units.formatNative(event.getPrice()));
    }

    @EventListener
    public void onReferralRewardPaid(ReferralRewardPaid event) {
        log.debug("[EVENT] ReferralRewardPaid recipient={} amount={} kind={}",
                event.getRecipient(), Units.formatNative(event.getAmount()), event.getKind());
    }

    @EventListener
    public void onOtherEvent(MarketEvent event) {
        if (event instanceof RoundStarted || event instanceof SaleTokenBought
                || event instanceof OrderRedeemed || event instanceof ReferralRewardPaid) {
            return;
        }
        log.info("[EVENT] {}", event);
    }
}
