package com.linkdeck.linkservice.infrastructure.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.linkdeck.security.VerifiedIdentity;

/** The {@code user} object returned by the provider and carried in the OAuth session cookie. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityClaims(String id, String email, String name, String role) {

    boolean hasId() {
        return id != null && !id.isBlank();
    }

    VerifiedIdentity toIdentity() {
        return new VerifiedIdentity(id, email, name, role);
    }
}
