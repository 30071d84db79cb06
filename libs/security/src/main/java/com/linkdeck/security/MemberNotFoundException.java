package com.linkdeck.security;

public class MemberNotFoundException extends DomainException {

    public MemberNotFoundException(String orgId) {
        super(ErrorCode.MEMBER_NOT_FOUND, "No such member in organization %s".formatted(orgId));
    }
}
