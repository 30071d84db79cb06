package com.linkdeck.security;

/**
 * Identity claims returned by the identity provider for a valid session.
 *
 * @param id    provider user id (the local user's external id)
 * @param email email address as reported by the provider
 * @param name  display name
 * @param role  provider-side role claim (e.g., "user", "admin", "superadmin")
 */
public record VerifiedIdentity(String id, String email, String name, String role) {
}
