package com.linkdeck.security;

/**
 * Thrown when a request that requires a session has none, or an invalid or expired one.
 */
public class AuthenticationFailureException extends DomainException {

    public AuthenticationFailureException() {
        super(ErrorCode.UNAUTHORIZED, "Valid session required");
    }
}
