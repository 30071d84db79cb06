package com.linkdeck.security;

import java.util.Collection;
import java.util.Set;

/**
 * Immutable set of permission strings granted by a role.
 *
 * @param permissions the granted permission strings
 */
public record PermissionSet(Set<String> permissions) {

    public PermissionSet {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    /** Creates a set from the given permission strings. */
    public static PermissionSet of(String... permissions) {
        return new PermissionSet(Set.of(permissions));
    }

    /** Creates a set from any collection of permission strings. */
    public static PermissionSet copyOf(Collection<String> permissions) {
        return new PermissionSet(Set.copyOf(permissions));
    }

    /** Set-membership test for one permission. */
    public boolean allows(String permission) {
        return permission != null && permissions.contains(permission);
    }

    public boolean isEmpty() {
        return permissions.isEmpty();
    }
}
