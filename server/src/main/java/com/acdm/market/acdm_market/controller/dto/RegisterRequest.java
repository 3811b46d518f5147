package com.acdm.market.acdm_market.controller.dto;

import lombok.Data;

@Data
public class RegisterRequest {
    private String sponsor;
}
