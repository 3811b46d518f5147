package com.acdm.market.acdm_market.controller.dto;

import com.acdm.market.acdm_market.entity.RoundPhase;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Rates are basis points; the engine enforces the range.
 */
@Data
public class ReferralRatesRequest {
    @NotNull
    private RoundPhase phase;
    @NotNull
    private Integer l1Rate;
    @NotNull
    private Integer l2Rate;
}
