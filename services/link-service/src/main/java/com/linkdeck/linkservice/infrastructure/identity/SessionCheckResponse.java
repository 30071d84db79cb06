package com.linkdeck.linkservice.infrastructure.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the provider's session endpoints: {@code {isValid, message?, user?}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCheckResponse(
        @JsonProperty("isValid") Boolean isValid,
        @JsonProperty("message") String message,
        @JsonProperty("user") IdentityClaims user) {

    /** Valid only when the provider says so and names a user. */
    public boolean verified() {
        return Boolean.TRUE.equals(isValid) && user != null && user.hasId();
    }
}
