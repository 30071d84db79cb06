package com.linkdeck.linkservice.domain.membership;

/**
 * The caller of a membership change.
 *
 * @param userId     caller's external user id
 * @param role       caller's role in the target organization, null when not a member
 * @param superAdmin whether the caller is a platform super-admin
 */
public record Actor(String userId, String role, boolean superAdmin) {

    public static Actor member(String userId, String role) {
        return new Actor(userId, role, false);
    }

    public static Actor superAdmin(String userId) {
        return new Actor(userId, null, true);
    }
}
