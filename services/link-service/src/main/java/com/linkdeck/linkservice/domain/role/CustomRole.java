package com.linkdeck.linkservice.domain.role;

import com.linkdeck.security.PermissionSet;
import java.time.Instant;

/**
 * An organization-defined role.
 *
 * @param organizationId owning organization
 * @param roleId role id referenced by memberships; never {@code admin} or {@code user}
 * @param permissions granted permissions
 * @param createdAt creation time
 * @param updatedAt last redefinition
 */
public record CustomRole(
        String organizationId,
        String roleId,
        PermissionSet permissions,
        Instant createdAt,
        Instant updatedAt) {
}
