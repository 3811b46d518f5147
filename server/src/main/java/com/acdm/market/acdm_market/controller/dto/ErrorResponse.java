package com.acdm.market.acdm_market.controller.dto;

import lombok.Value;

@Value
public class ErrorResponse {
    String reason;
    String message;
}
