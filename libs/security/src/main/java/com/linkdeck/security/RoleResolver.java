package com.linkdeck.security;

import com.linkdeck.observability.LogRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves a role id within an organization to its permission set.
 * <p>
 * System roles resolve to constants with no I/O. Custom roles go through the
 * {@link RoleCache}; a miss reads {@link RoleStore} and caches a hit. Unknown roles are not
 * cached, so every lookup of an undefined role reads storage again. A storage failure
 * resolves to empty.
 */
public class RoleResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private final RoleStore roleStore;
    private final RoleCache cache;

    public RoleResolver(RoleStore roleStore, RoleCache cache) {
        this.roleStore = roleStore;
        this.cache = cache;
    }

    /**
     * @param orgId  organization the role belongs to (ignored for system roles)
     * @param roleId role id stored on the membership
     * @return the permission set, or empty if the role is unknown or could not be read
     */
    public Optional<PermissionSet> resolve(String orgId, String roleId) {
        if (roleId == null || roleId.isBlank()) {
            return Optional.empty();
        }
        Optional<SystemRole> systemRole = SystemRole.fromId(roleId);
        if (systemRole.isPresent()) {
            return Optional.of(systemRole.get().permissions());
        }
        if (orgId == null || orgId.isBlank()) {
            return Optional.empty();
        }

        RoleKey key = new RoleKey(orgId, roleId);
        Optional<PermissionSet> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<PermissionSet> stored;
        try {
            stored = roleStore.findPermissions(orgId, roleId);
        } catch (RuntimeException e) {
            log.error("Custom role lookup failed for org={} role={}; denying", LogRedactor.truncate(orgId), roleId, e);
            return Optional.empty();
        }
        stored.ifPresent(permissions -> cache.put(key, permissions));
        return stored;
    }

    /**
     * Drops a custom role from the cache after it was redefined or deleted.
     */
    public void invalidate(String orgId, String roleId) {
        cache.invalidate(new RoleKey(orgId, roleId));
    }
}
