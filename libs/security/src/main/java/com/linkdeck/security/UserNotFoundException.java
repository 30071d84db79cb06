package com.linkdeck.security;

/**
 * Thrown when a user to be added has never signed in, so no local record exists.
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(String message) {
        super(ErrorCode.USER_NOT_FOUND, message);
    }
}
