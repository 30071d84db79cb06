package com.linkdeck.security;

import java.util.Optional;

/**
 * Process-wide cache of custom role permission sets.
 * <p>
 * Implementations must never return an entry older than their TTL and must be safe for
 * concurrent use. The in-memory default is {@link CaffeineRoleCache}; a distributed
 * implementation can replace it behind this interface.
 */
public interface RoleCache {

    /** Returns the cached permissions if present and not expired. */
    Optional<PermissionSet> get(RoleKey key);

    /** Stores permissions for the key, restarting its TTL. */
    void put(RoleKey key, PermissionSet permissions);

    /** Drops one entry. */
    void invalidate(RoleKey key);

    /** Drops every entry. */
    void invalidateAll();

    /**
     * Evicts expired entries.
     *
     * @return number of entries removed by this sweep
     */
    long sweep();

    /** Approximate number of live entries. */
    long size();
}
