package com.acdm.market.acdm_market.events;

import com.acdm.market.acdm_market.entity.Role;

import lombok.Value;

@Value
public class RoleChanged implements MarketEvent {
    Role role;
    String account;
    boolean granted;
    String changedBy;
}
