package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.ReferralEdge;
import com.acdm.market.acdm_market.entity.TokenBalance;
import com.acdm.market.acdm_market.events.MarketEvent;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one successful call changed. Handed to commit listeners after the
 * change is visible in the engine.
 */
@Value
@Builder
public class MarketCommit {
    String operation;
    String caller;
    MarketState state;
    List<Order> savedOrders;
    List<Long> removedOrderIds;
    List<ReferralEdge> newEdges;
    List<TokenBalance> balances;
    List<MarketEvent> events;
}
