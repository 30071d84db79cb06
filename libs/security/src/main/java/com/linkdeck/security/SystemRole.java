package com.linkdeck.security;

import java.util.Optional;

/**
 * Built-in organization roles. Their permission sets are fixed in code and resolving them
 * never touches storage.
 * <p>
 * ADMIN holds every permission; USER works with cards and can see the member list.
 */
public enum SystemRole {

    ADMIN("admin", PermissionSet.copyOf(Permissions.ALL)),
    USER("user", PermissionSet.of(
            Permissions.CARDS_READ,
            Permissions.CARDS_WRITE,
            Permissions.CARDS_DELETE,
            Permissions.MEMBERS_READ));

    private final String id;
    private final PermissionSet permissions;

    SystemRole(String id, PermissionSet permissions) {
        this.id = id;
        this.permissions = permissions;
    }

    /** The role id as stored on memberships (e.g., "admin"). */
    public String id() {
        return id;
    }

    /** The constant permission set of this role. */
    public PermissionSet permissions() {
        return permissions;
    }

    /**
     * Looks up a system role by id.
     *
     * @param id the role id to match (case-sensitive)
     * @return the matching role, or empty for custom or unknown role ids
     */
    public static Optional<SystemRole> fromId(String id) {
        for (SystemRole role : values()) {
            if (role.id.equals(id)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a role id names a system role. */
    public static boolean isSystemRole(String id) {
        return fromId(id).isPresent();
    }

    /** Checks whether a role id is the admin role. */
    public static boolean isAdmin(String id) {
        return ADMIN.id.equals(id);
    }
}
