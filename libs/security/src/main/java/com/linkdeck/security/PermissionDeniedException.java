package com.linkdeck.security;

/**
 * Thrown when an authenticated caller lacks a permission in the target organization.
 */
public class PermissionDeniedException extends DomainException {

    private final String permission;

    public PermissionDeniedException(String permission) {
        super(ErrorCode.PERMISSION_DENIED,
                "You do not have permission to perform this action (required: %s)".formatted(permission));
        this.permission = permission;
    }

    public String permission() {
        return permission;
    }
}
