package com.linkdeck.security;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Membership memo for one inbound request.
 * <p>
 * Remembers the role (or non-membership) of a {@code (userId, orgId)} pair so that a
 * handler checking several permissions reads membership storage once. Lives exactly as long
 * as the request and is confined to its thread, so it is not synchronized.
 */
public final class RequestScope {

    private final Map<Key, Optional<String>> memberships = new HashMap<>();

    /** Whether the pair has already been looked up in this request. */
    public boolean contains(String userId, String orgId) {
        return memberships.containsKey(new Key(userId, orgId));
    }

    /**
     * Returns the memoized role, empty when the user is memoized as a non-member or nothing
     * has been memoized yet; use {@link #contains(String, String)} to tell the two apart.
     */
    public Optional<String> role(String userId, String orgId) {
        return memberships.getOrDefault(new Key(userId, orgId), Optional.empty());
    }

    /** Memoizes a lookup result; an empty role records non-membership. */
    public void remember(String userId, String orgId, Optional<String> role) {
        memberships.put(new Key(userId, orgId), role);
    }

    public int size() {
        return memberships.size();
    }

    private record Key(String userId, String orgId) {
    }
}
