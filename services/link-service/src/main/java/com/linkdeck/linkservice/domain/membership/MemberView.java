package com.linkdeck.linkservice.domain.membership;

import com.linkdeck.security.LocalUser;
import java.time.Instant;

/**
 * A membership joined with the member's profile. Profile fields are null when the user record is
 * missing.
 */
public record MemberView(
        String userId,
        String role,
        String addedBy,
        Instant addedAt,
        Instant updatedAt,
        String email,
        String name,
        boolean superAdmin) {

    public static MemberView of(Membership membership, LocalUser user) {
        return new MemberView(
                membership.userId(),
                membership.role(),
                membership.addedBy(),
                membership.addedAt(),
                membership.updatedAt(),
                user == null ? null : user.email(),
                user == null ? null : user.name(),
                user != null && user.superAdmin());
    }
}
