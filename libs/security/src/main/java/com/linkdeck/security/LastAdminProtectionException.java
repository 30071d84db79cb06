package com.linkdeck.security;

/**
 * Thrown when a demotion or removal would leave an organization without any admin.
 */
public class LastAdminProtectionException extends DomainException {

    private final String orgId;
    private final String userId;

    public LastAdminProtectionException(String orgId, String userId, String action) {
        super(ErrorCode.LAST_ADMIN_PROTECTION,
                "Cannot %s the last admin. This organization must have at least one admin; promote another member first."
                        .formatted(action));
        this.orgId = orgId;
        this.userId = userId;
    }

    public String orgId() {
        return orgId;
    }

    public String userId() {
        return userId;
    }
}
