package com.linkdeck.security;

public class RoleNotFoundException extends DomainException {

    public RoleNotFoundException(String orgId, String roleId) {
        super(ErrorCode.ROLE_NOT_FOUND, "Role '%s' is not defined in organization %s".formatted(roleId, orgId));
    }
}
