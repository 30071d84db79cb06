package com.linkdeck.security;

import java.util.Optional;

/**
 * Result of validating a session: either valid with the local user, or invalid.
 *
 * @param valid whether the caller is authenticated
 * @param user  the local user (null when invalid)
 */
public record SessionResult(boolean valid, LocalUser user) {

    private static final SessionResult INVALID = new SessionResult(false, null);

    public static SessionResult valid(LocalUser user) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null for a valid session");
        }
        return new SessionResult(true, user);
    }

    public static SessionResult invalid() {
        return INVALID;
    }

    /** The user when valid, empty otherwise. */
    public Optional<LocalUser> authenticatedUser() {
        return valid ? Optional.of(user) : Optional.empty();
    }
}
