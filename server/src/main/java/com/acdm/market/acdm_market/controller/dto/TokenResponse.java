package com.acdm.market.acdm_market.controller.dto;

import lombok.Value;

@Value
public class TokenResponse {
    String account;
    String accessToken;
}
