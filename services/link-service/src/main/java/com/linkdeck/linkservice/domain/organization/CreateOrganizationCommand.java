package com.linkdeck.linkservice.domain.organization;

/**
 * @param name display name, required
 * @param slug requested slug, normalized to lowercase
 * @param description optional description
 */
public record CreateOrganizationCommand(String name, String slug, String description) {
}
