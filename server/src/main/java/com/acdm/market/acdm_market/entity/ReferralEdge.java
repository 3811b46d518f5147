package com.acdm.market.acdm_market.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Permanent referee → sponsor link. Written once, never updated.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "referrals")
public class ReferralEdge {

    @Id
    private String referee;

    @Indexed
    private String sponsor;

    private long registeredAt;
}
