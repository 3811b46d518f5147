package com.acdm.market.acdm_market.exception;

import com.acdm.market.acdm_market.entity.Role;

public class PermissionDeniedException extends MarketException {

    private final String account;
    private final Role requiredRole;

    public PermissionDeniedException(String account, Role requiredRole) {
        super("PermissionDenied", String.format("Account %s is missing role %s", account, requiredRole));
        this.account = account;
        this.requiredRole = requiredRole;
    }

    public String getAccount() {
        return account;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }
}
