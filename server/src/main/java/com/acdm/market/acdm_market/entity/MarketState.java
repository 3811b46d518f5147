package com.acdm.market.acdm_market.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * All scalar durable state of the market: the round record, counters, the
 * engine's native balance and the admin-tunable parameters.
 * Orders and referral edges live in their own collections.
 */
@Document(collection = "market_state")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class MarketState {

    public static final String SINGLETON_ID = "acdm";

    @Id
    private String id;

    private Round round;

    /**
     * Last order id handed out. The next order gets lastOrderId + 1.
     */
    private long lastOrderId;

    /**
     * Native currency held by the engine, in base units.
     */
    private BigInteger nativeBalance;

    private ReferralRewardConfig rewardConfig;

    /**
     * Length of every round, in seconds.
     */
    private long roundDuration;

    /**
     * Receives referral rewards nobody is entitled to.
     */
    private String fallbackSink;

    /**
     * Role name → member accounts.
     */
    @Builder.Default
    private Map<String, Set<String>> roleMembers = new HashMap<>();

    private long lastCommittedAt;

    public boolean hasRole(Role role, String account) {
        Set<String> members = roleMembers.get(role.name());
        return members != null && members.contains(account);
    }

    public boolean grantRole(Role role, String account) {
        return roleMembers.computeIfAbsent(role.name(), r -> new LinkedHashSet<>()).add(account);
    }

    public boolean revokeRole(Role role, String account) {
        Set<String> members = roleMembers.get(role.name());
        return members != null && members.remove(account);
    }

    /**
     * Deep copy used to stage changes of a call before they are committed.
     */
    public MarketState copy() {
        Map<String, Set<String>> members = new HashMap<>();
        roleMembers.forEach((role, accounts) -> members.put(role, new LinkedHashSet<>(accounts)));
        return toBuilder()
                .round(round.copy())
                .roleMembers(members)
                .build();
    }
}
