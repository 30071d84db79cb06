package com.linkdeck.security;

import java.util.Optional;

/**
 * Persistent storage of organization-defined (custom) roles.
 */
public interface RoleStore {

    /**
     * Reads the permission set of a custom role.
     *
     * @return the permissions, or empty when the role is not defined in that organization
     */
    Optional<PermissionSet> findPermissions(String orgId, String roleId);
}
