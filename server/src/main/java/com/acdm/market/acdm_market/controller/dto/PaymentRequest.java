package com.acdm.market.acdm_market.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Native payment attached to a call, base units as a decimal string.
 */
@Data
public class PaymentRequest {
    @NotBlank
    @Pattern(regexp = "\\d+", message = "must be a non-negative integer amount in base units")
    private String payment;
}
