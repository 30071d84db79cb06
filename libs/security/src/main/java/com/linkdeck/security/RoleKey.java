package com.linkdeck.security;

/**
 * Cache key for a custom role within one organization.
 */
public record RoleKey(String orgId, String roleId) {
}
