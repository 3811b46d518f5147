package com.acdm.market.acdm_market.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Token balance of one account in the process-local ledger, as of the last
 * committed call that touched it.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "token_balances")
public class TokenBalance {

    @Id
    private String account;

    private BigInteger balance;

    /**
     * Epoch seconds.
     */
    private long updatedAt;
}
