package com.acdm.market.acdm_market.controller.dto;

import lombok.Value;

@Value
public class ReferralView {
    String account;
    String sponsor;
}
