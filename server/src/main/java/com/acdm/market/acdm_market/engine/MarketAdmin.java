package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.MarketState;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.Role;
import com.acdm.market.acdm_market.entity.RoundPhase;
import com.acdm.market.acdm_market.events.FallbackSinkUpdated;
import com.acdm.market.acdm_market.events.FundsWithdrawn;
import com.acdm.market.acdm_market.events.RefRewardConfigUpdated;
import com.acdm.market.acdm_market.events.RoleChanged;
import com.acdm.market.acdm_market.events.RoundDurationUpdated;
import com.acdm.market.acdm_market.exception.PermissionDeniedException;
import com.acdm.market.acdm_market.exception.ValidationException;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Privileged operations. ADMIN manages funds, timing, the fallback sink and
 * roles; DAO manages referral rates.
 */
@Slf4j
public class MarketAdmin {

    public BigInteger withdrawFunds(MarketTransaction tx, String recipient, BigInteger amount) {
        requireRole(tx, Role.ADMIN);
        if (recipient == null || recipient.isBlank()) {
            throw new ValidationException("Not valid recipient address");
        }
        if (amount == null || amount.signum() <= 0 || amount.compareTo(tx.state().getNativeBalance()) > 0) {
            throw new ValidationException("Insufficient ether amount to transfer");
        }
        tx.pay(recipient, amount, PayoutKind.WITHDRAWAL);
        tx.emit(new FundsWithdrawn(recipient, amount));
        log.info("Funds withdrawn: recipient={}, amount={}, by={}", recipient, amount, tx.caller());
        return tx.state().getNativeBalance();
    }

    public ReferralRewardConfig updateReferralRates(MarketTransaction tx, RoundPhase phase, int l1Rate, int l2Rate) {
        requireRole(tx, Role.DAO);
        if (phase == null) {
            throw new ValidationException("Round phase is required");
        }
        if (!isValidRate(l1Rate) || !isValidRate(l2Rate)) {
            throw new ValidationException("Not valid referral rate");
        }
        if (l1Rate + l2Rate > ReferralRewardConfig.MAX_RATE) {
            throw new ValidationException("Referral rates exceed 100%");
        }
        MarketState state = tx.state();
        ReferralRewardConfig updated = state.getRewardConfig().withRates(phase, l1Rate, l2Rate);
        state.setRewardConfig(updated);
        tx.emit(new RefRewardConfigUpdated(phase, l1Rate, l2Rate));
        log.info("Referral rates updated: phase={}, l1={}, l2={}, by={}", phase, l1Rate, l2Rate, tx.caller());
        return updated;
    }

    /**
     * Applies to rounds started afterwards; the running round keeps its end time.
     */
    public long updateRoundDuration(MarketTransaction tx, long seconds) {
        requireRole(tx, Role.ADMIN);
        if (seconds <= 0) {
            throw new ValidationException("Not valid round duration");
        }
        tx.state().setRoundDuration(seconds);
        tx.emit(new RoundDurationUpdated(seconds));
        log.info("Round duration updated: seconds={}, by={}", seconds, tx.caller());
        return seconds;
    }

    public String updateFallbackSink(MarketTransaction tx, String fallbackSink) {
        requireRole(tx, Role.ADMIN);
        if (fallbackSink == null || fallbackSink.isBlank()) {
            throw new ValidationException("Not valid fallback sink address");
        }
        tx.state().setFallbackSink(fallbackSink);
        tx.emit(new FallbackSinkUpdated(fallbackSink));
        log.info("Fallback sink updated: sink={}, by={}", fallbackSink, tx.caller());
        return fallbackSink;
    }

    public boolean grantRole(MarketTransaction tx, Role role, String account) {
        requireRole(tx, Role.ADMIN);
        requireAccount(role, account);
        boolean changed = tx.state().grantRole(role, account);
        if (changed) {
            tx.emit(new RoleChanged(role, account, true, tx.caller()));
            log.info("Role granted: role={}, account={}, by={}", role, account, tx.caller());
        }
        return changed;
    }

    public boolean revokeRole(MarketTransaction tx, Role role, String account) {
        requireRole(tx, Role.ADMIN);
        requireAccount(role, account);
        if (role == Role.ADMIN && account.equals(tx.caller())) {
            throw new ValidationException("Admin cannot revoke own admin role");
        }
        boolean changed = tx.state().revokeRole(role, account);
        if (changed) {
            tx.emit(new RoleChanged(role, account, false, tx.caller()));
            log.info("Role revoked: role={}, account={}, by={}", role, account, tx.caller());
        }
        return changed;
    }

    private static void requireRole(MarketTransaction tx, Role role) {
        if (!tx.state().hasRole(role, tx.caller())) {
            throw new PermissionDeniedException(tx.caller(), role);
        }
    }

    private static void requireAccount(Role role, String account) {
        if (role == null) {
            throw new ValidationException("Role is required");
        }
        if (account == null || account.isBlank()) {
            throw new ValidationException("Not valid account address");
        }
    }

    private static boolean isValidRate(int rate) {
        return rate >= 0 && rate <= ReferralRewardConfig.MAX_RATE;
    }
}
