package com.linkdeck.security;

/**
 * Thrown when adding a user who already has a membership in the organization.
 */
public class DuplicateMemberException extends DomainException {

    public DuplicateMemberException(String orgId) {
        super(ErrorCode.DUPLICATE_MEMBER, "User is already a member of organization %s".formatted(orgId));
    }
}
