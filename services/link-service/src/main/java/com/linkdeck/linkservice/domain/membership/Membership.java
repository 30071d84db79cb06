package com.linkdeck.linkservice.domain.membership;

import java.time.Instant;

/**
 * A user's role in one organization. At most one per {@code (organizationId, userId)}.
 *
 * @param organizationId organization id
 * @param userId provider user id
 * @param role {@code admin}, {@code user} or a custom role id of the organization
 * @param addedBy user id of whoever created the membership
 * @param addedAt creation time
 * @param updatedAt last role change
 */
public record Membership(
        String organizationId,
        String userId,
        String role,
        String addedBy,
        Instant addedAt,
        Instant updatedAt) {

    public Membership withRole(String newRole, Instant at) {
        return new Membership(organizationId, userId, newRole, addedBy, addedAt, at);
    }
}
