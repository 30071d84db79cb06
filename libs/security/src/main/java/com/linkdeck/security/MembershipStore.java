package com.linkdeck.security;

import java.util.Optional;

/**
 * Read access to organization memberships needed by authorization decisions.
 */
public interface MembershipStore {

    /**
     * Returns the role id a user holds in an organization.
     *
     * @return the role id ("admin", "user" or a custom role id), or empty for non-members
     */
    Optional<String> findRole(String orgId, String userId);

    /**
     * Counts members of the organization whose role is {@code admin}.
     */
    long countAdmins(String orgId);
}
