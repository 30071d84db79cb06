package com.linkdeck.linkservice.domain.organization;

import java.time.Instant;

/**
 * A tenant.
 *
 * @param id stable organization id
 * @param slug unique lowercase url name, {@code [a-z0-9-]{2,}}
 * @param name display name
 * @param description optional description
 * @param active inactive organizations cannot be addressed
 * @param createdAt creation time
 * @param updatedAt last change
 */
public record Organization(
        String id,
        String slug,
        String name,
        String description,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {
}
