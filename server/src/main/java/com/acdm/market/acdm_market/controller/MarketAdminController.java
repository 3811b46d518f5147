package com.acdm.market.acdm_market.controller;

import java.math.BigInteger;
import java.util.Map;

import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.acdm.market.acdm_market.controller.dto.FallbackSinkRequest;
import com.acdm.market.acdm_market.controller.dto.ReferralRatesRequest;
import com.acdm.market.acdm_market.controller.dto.RoleRequest;
import com.acdm.market.acdm_market.controller.dto.RoundDurationRequest;
import com.acdm.market.acdm_market.controller.dto.WithdrawRequest;
import com.acdm.market.acdm_market.engine.MarketEngine;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.execution.MarketExecutor;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Privileged calls. Role checks happen inside the engine against the caller's granted roles.
 */
@RestController
@RequestMapping("/api/market/admin")
@RequiredArgsConstructor
public class MarketAdminController {

    private final MarketEngine marketEngine;
    private final MarketExecutor marketExecutor;

    @PostMapping("/withdraw")
    public Map<String, Object> withdrawFunds(Authentication auth, @Valid @RequestBody WithdrawRequest request) {
        String caller = auth.getName();
        BigInteger amount = new BigInteger(request.getAmount());
        BigInteger remaining = marketExecutor.submit(
                () -> marketEngine.withdrawFunds(caller, request.getRecipient(), amount));
        return Map.of("recipient", request.getRecipient(), "amount", amount, "remainingBalance", remaining);
    }

    @PutMapping("/referral-rates")
    public ReferralRewardConfig updateReferralRates(Authentication auth,
            @Valid @RequestBody ReferralRatesRequest request) {
        String caller = auth.getName();
        return marketExecutor.submit(() -> marketEngine.updateReferralRates(
                caller, request.getPhase(), request.getL1Rate(), request.getL2Rate()));
    }

    @PutMapping("/round-duration")
    public Map<String, Long> updateRoundDuration(Authentication auth, @Valid @RequestBody RoundDurationRequest request) {
        String caller = auth.getName();
        long seconds = marketExecutor.submit(() -> marketEngine.updateRoundDuration(caller, request.getSeconds()));
        return Map.of("roundDuration", seconds);
    }

    @PutMapping("/fallback-sink")
    public Map<String, String> updateFallbackSink(Authentication auth, @RequestBody FallbackSinkRequest request) {
        String caller = auth.getName();
        String sink = marketExecutor.submit(() -> marketEngine.updateFallbackSink(caller, request.getFallbackSink()));
        return Map.of("fallbackSink", sink);
    }

    @PostMapping("/roles/grant")
    public Map<String, Object> grantRole(Authentication auth, @RequestBody RoleRequest request) {
        String caller = auth.getName();
        boolean changed = marketExecutor.submit(() -> marketEngine.grantRole(caller, request.getRole(), request.getAccount()));
        return Map.of("role", request.getRole(), "account", request.getAccount(), "changed", changed);
    }

    @PostMapping("/roles/revoke")
    public Map<String, Object> revokeRole(Authentication auth, @RequestBody RoleRequest request) {
        String caller = auth.getName();
        boolean changed = marketExecutor.submit(() -> marketEngine.revokeRole(caller, request.getRole(), request.getAccount()));
        return Map.of("role", request.getRole(), "account", request.getAccount(), "changed", changed);
    }
}
