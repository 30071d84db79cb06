package com.linkdeck.linkservice.domain.organization;

/**
 * An organization as seen by one user.
 *
 * @param organization the organization
 * @param role the user's role in it, null for a super-admin who is not a member
 */
public record OrganizationMembership(Organization organization, String role) {
}
