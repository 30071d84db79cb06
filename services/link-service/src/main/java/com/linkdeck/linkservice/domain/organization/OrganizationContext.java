package com.linkdeck.linkservice.domain.organization;

/**
 * The organization a request acts on, resolved from the request and confirmed active.
 *
 * @param organizationId organization id
 * @param slug organization slug
 */
public record OrganizationContext(String organizationId, String slug) {

    public static OrganizationContext of(Organization organization) {
        return new OrganizationContext(organization.id(), organization.slug());
    }
}
