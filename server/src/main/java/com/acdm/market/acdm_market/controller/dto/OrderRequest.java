package com.acdm.market.acdm_market.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class OrderRequest {
    /** Token base units. */
    @NotBlank
    @Pattern(regexp = "\\d+")
    private String amount;

    /** Native base units per whole token. */
    @NotBlank
    @Pattern(regexp = "\\d+")
    private String pricePerToken;
}
