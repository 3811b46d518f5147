package com.acdm.market.acdm_market.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class WithdrawRequest {
    private String recipient;

    @NotBlank
    @Pattern(regexp = "\\d+")
    private String amount;
}
