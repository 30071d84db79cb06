package com.linkdeck.linkservice.infrastructure.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkdeck.linkservice.domain.session.SessionRequest;
import com.linkdeck.linkservice.domain.session.SessionStrategy;
import com.linkdeck.security.SessionVerdict;
import java.io.IOException;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads the session cookie written by the OAuth callback: Base64 of
 * {@code {"expires_at": <epoch millis>, "user": {...}}}.
 */
public class OAuthCookieSessionStrategy implements SessionStrategy {

    private final String cookieName;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OAuthCookieSessionStrategy(String cookieName, ObjectMapper objectMapper, Clock clock) {
        this.cookieName = cookieName;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public SessionVerdict evaluate(SessionRequest request) {
        Optional<String> cookie = cookieValue(request.cookieHeader(), cookieName);
        if (cookie.isEmpty()) {
            return SessionVerdict.rejected("No session cookie present");
        }

        OAuthSession session;
        try {
            byte[] json = Base64.getDecoder().decode(cookie.get());
            session = objectMapper.readValue(json, OAuthSession.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new IdentityProviderException("Session cookie could not be decoded", e);
        }

        if (session.expiresAt() == null || session.expiresAt() < clock.millis()) {
            return SessionVerdict.rejected("Session expired",
                    session.user() != null && session.user().hasId() ? session.user().toIdentity() : null);
        }
        if (session.user() == null || !session.user().hasId()) {
            return SessionVerdict.rejected("Session carries no user");
        }
        return SessionVerdict.verified(session.user().toIdentity());
    }

    @Override
    public String name() {
        return "oauth-cookie";
    }

    static Optional<String> cookieValue(String cookieHeader, String name) {
        if (cookieHeader == null || cookieHeader.isBlank()) {
            return Optional.empty();
        }
        for (String part : cookieHeader.split(";")) {
            String[] pair = part.trim().split("=", 2);
            if (pair.length == 2 && pair[0].trim().equals(name) && !pair[1].isBlank()) {
                return Optional.of(pair[1].trim());
            }
        }
        return Optional.empty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OAuthSession(@JsonProperty("expires_at") Long expiresAt, @JsonProperty("user") IdentityClaims user) {
    }
}
