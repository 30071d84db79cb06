package com.linkdeck.security;

import java.time.Instant;

/**
 * Local mirror of an identity-provider verified user.
 * <p>
 * {@code superAdmin} is managed locally and is never overwritten from provider claims.
 * The admin flag is derived from the provider role claim on read and is not stored.
 *
 * @param externalId   provider user id, unique
 * @param email        email address (lowercase)
 * @param name         display name
 * @param identityRole provider role claim
 * @param superAdmin   local flag that bypasses every organization-level check
 * @param createdAt    first time the user was seen (set once)
 * @param lastLoginAt  last successful session validation
 * @param updatedAt    last profile refresh
 */
public record LocalUser(
        String externalId,
        String email,
        String name,
        String identityRole,
        boolean superAdmin,
        Instant createdAt,
        Instant lastLoginAt,
        Instant updatedAt
) {

    /**
     * Derived admin flag: true when the provider reports an admin or superadmin role.
     */
    public boolean isAdmin() {
        return "admin".equalsIgnoreCase(identityRole) || "superadmin".equalsIgnoreCase(identityRole);
    }

    /**
     * Builds an in-memory user straight from verified claims. Used when the local store could
     * not be written; carries no local privileges.
     */
    public static LocalUser fromClaims(VerifiedIdentity identity, Instant now) {
        return new LocalUser(
                identity.id(),
                identity.email() == null ? null : identity.email().toLowerCase(),
                identity.name(),
                identity.role(),
                false,
                now,
                now,
                now);
    }
}
