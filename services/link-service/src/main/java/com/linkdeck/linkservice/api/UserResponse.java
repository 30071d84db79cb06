package com.linkdeck.linkservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkdeck.security.LocalUser;
import java.time.Instant;

/** The caller as returned by the session endpoint. {@code isAdmin} is derived on every read. */
public record UserResponse(
        String id,
        String email,
        String name,
        String role,
        @JsonProperty("isAdmin") boolean isAdmin,
        @JsonProperty("isSuperAdmin") boolean isSuperAdmin,
        Instant createdAt,
        Instant lastLoginAt) {

    public static UserResponse of(LocalUser user) {
        return new UserResponse(
                user.externalId(),
                user.email(),
                user.name(),
                user.identityRole(),
                user.isAdmin(),
                user.superAdmin(),
                user.createdAt(),
                user.lastLoginAt());
    }
}
