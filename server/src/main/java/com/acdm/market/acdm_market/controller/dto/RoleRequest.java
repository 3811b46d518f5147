package com.acdm.market.acdm_market.controller.dto;

import com.acdm.market.acdm_market.entity.Role;

import lombok.Data;

@Data
public class RoleRequest {
    private Role role;
    private String account;
}
