package com.linkdeck.security;

/**
 * Thrown for a role id that cannot be assigned or defined in the organization.
 */
public class InvalidRoleException extends DomainException {

    public InvalidRoleException(String message) {
        super(ErrorCode.INVALID_ROLE, message);
    }
}
