package com.acdm.market.acdm_market.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RoundDurationRequest {
    @NotNull
    private Long seconds;
}
