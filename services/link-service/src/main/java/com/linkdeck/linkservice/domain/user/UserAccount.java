package com.linkdeck.linkservice.domain.user;

import java.time.Instant;

/**
 * A local user as the administration screens see it: profile plus application access.
 *
 * @param userId       provider user id
 * @param email        lower-cased email, when known
 * @param name         display name
 * @param identityRole role claim last reported by the identity provider
 * @param appRole      application role granted locally
 * @param appStatus    approval status
 * @param hasAccess    whether the user may use the application
 * @param createdAt    first sign-in
 * @param lastLoginAt  latest sign-in
 * @param updatedAt    last change to the row
 */
public record UserAccount(
        String userId,
        String email,
        String name,
        String identityRole,
        AppRole appRole,
        AccessStatus appStatus,
        boolean hasAccess,
        Instant createdAt,
        Instant lastLoginAt,
        Instant updatedAt) {
}
