package com.acdm.market.acdm_market.controller;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.acdm.market.acdm_market.controller.dto.MarketInfoView;
import com.acdm.market.acdm_market.controller.dto.OrderRequest;
import com.acdm.market.acdm_market.controller.dto.OrderView;
import com.acdm.market.acdm_market.controller.dto.PaymentRequest;
import com.acdm.market.acdm_market.controller.dto.ReferralView;
import com.acdm.market.acdm_market.controller.dto.RegisterRequest;
import com.acdm.market.acdm_market.controller.dto.RemovedOrderView;
import com.acdm.market.acdm_market.controller.dto.RoundView;
import com.acdm.market.acdm_market.engine.MarketEngine;
import com.acdm.market.acdm_market.events.OrderRedeemed;
import com.acdm.market.acdm_market.events.RoundStarted;
import com.acdm.market.acdm_market.events.SaleTokenBought;
import com.acdm.market.acdm_market.exception.StateNotFoundException;
import com.acdm.market.acdm_market.execution.MarketExecutor;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Participant API. The authenticated account is the caller of every market call;
 * mutating calls are serialized through the {@link MarketExecutor}.
 */
@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketEngine marketEngine;
    private final MarketExecutor marketExecutor;

    @GetMapping("/round")
    public RoundView round() {
        return RoundView.of(marketEngine.getRound(), marketEngine.isRoundActive());
    }

    @PostMapping("/rounds/sale")
    public RoundStarted startSaleRound(Authentication auth) {
        String caller = auth.getName();
        return marketExecutor.submit(() -> marketEngine.startSaleRound(caller));
    }

    @PostMapping("/rounds/trade")
    public RoundStarted startTradeRound(Authentication auth) {
        String caller = auth.getName();
        return marketExecutor.submit(() -> marketEngine.startTradeRound(caller));
    }

    @PostMapping("/sale/buy")
    public SaleTokenBought buySaleTokens(Authentication auth, @Valid @RequestBody PaymentRequest request) {
        String caller = auth.getName();
        BigInteger payment = new BigInteger(request.getPayment());
        return marketExecutor.submit(() -> marketEngine.buySaleTokens(caller, payment));
    }

    @GetMapping("/orders")
    public List<OrderView> orders(@RequestParam(required = false) String owner) {
        return (owner == null ? marketEngine.openOrders() : marketEngine.ordersOf(owner)).stream()
                .map(OrderView::of)
                .collect(Collectors.toList());
    }

    @GetMapping("/orders/{orderId}")
    public OrderView order(@PathVariable long orderId) {
        return marketEngine.findOrder(orderId)
                .map(OrderView::of)
                .orElseThrow(() -> new StateNotFoundException(orderId, "Order doesn't exist"));
    }

    @PostMapping("/orders")
    public OrderView addOrder(Authentication auth, @Valid @RequestBody OrderRequest request) {
        String caller = auth.getName();
        BigInteger amount = new BigInteger(request.getAmount());
        BigInteger price = new BigInteger(request.getPricePerToken());
        return OrderView.of(marketExecutor.submit(() -> marketEngine.addOrder(caller, amount, price)));
    }

    @DeleteMapping("/orders/{orderId}")
    public RemovedOrderView removeOrder(Authentication auth, @PathVariable long orderId) {
        String caller = auth.getName();
        BigInteger returned = marketExecutor.submit(() -> marketEngine.removeOrder(caller, orderId));
        return new RemovedOrderView(orderId, returned);
    }

    @PostMapping("/orders/{orderId}/redeem")
    public OrderRedeemed redeemOrder(Authentication auth, @PathVariable long orderId,
            @Valid @RequestBody PaymentRequest request) {
        String caller = auth.getName();
        BigInteger payment = new BigInteger(request.getPayment());
        return marketExecutor.submit(() -> marketEngine.redeemOrder(caller, orderId, payment));
    }

    @PostMapping("/referrals")
    public ReferralView register(Authentication auth, @RequestBody RegisterRequest request) {
        String caller = auth.getName();
        marketExecutor.submit(() -> {
            marketEngine.register(caller, request.getSponsor());
            return null;
        });
        return new ReferralView(caller, request.getSponsor());
    }

    @GetMapping("/referrals/{account}")
    public ResponseEntity<ReferralView> sponsorOf(@PathVariable String account) {
        return marketEngine.sponsorOf(account)
                .map(sponsor -> ResponseEntity.ok(new ReferralView(account, sponsor)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/config")
    public MarketInfoView config() {
        return MarketInfoView.builder()
                .rootAccount(marketEngine.getRootAccount())
                .custodyAccount(marketEngine.getCustodyAccount())
                .tokenDecimals(marketEngine.getTokenDecimals())
                .roundDuration(marketEngine.getRoundDuration())
                .fallbackSink(marketEngine.getFallbackSink())
                .nativeBalance(marketEngine.getNativeBalance())
                .rewardConfig(marketEngine.getRewardConfig())
                .build();
    }
}
