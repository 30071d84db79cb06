package com.linkdeck.linkservice.infrastructure.identity;

import com.linkdeck.linkservice.domain.session.SessionRequest;
import com.linkdeck.linkservice.domain.session.SessionStrategy;
import com.linkdeck.security.SessionVerdict;
import com.linkdeck.security.VerifiedIdentity;

/**
 * Forwards the caller's cookies to the provider's public session endpoint and, when that says
 * invalid, to the admin session endpoint.
 */
public class ProviderCookieSessionStrategy implements SessionStrategy {

    private final IdentityProviderClient client;

    public ProviderCookieSessionStrategy(IdentityProviderClient client) {
        this.client = client;
    }

    @Override
    public SessionVerdict evaluate(SessionRequest request) {
        SessionCheckResponse publicCheck = client.check(SessionEndpoint.PUBLIC, request.cookieHeader());
        if (publicCheck.verified()) {
            return SessionVerdict.verified(publicCheck.user().toIdentity());
        }
        if (!client.isConfigured(SessionEndpoint.ADMIN)) {
            return SessionVerdict.rejected(messageOf(publicCheck), claimsOf(publicCheck));
        }
        SessionCheckResponse adminCheck = client.check(SessionEndpoint.ADMIN, request.cookieHeader());
        if (adminCheck.verified()) {
            return SessionVerdict.verified(adminCheck.user().toIdentity());
        }
        VerifiedIdentity claimed = claimsOf(adminCheck);
        return SessionVerdict.rejected(adminCheck.message() != null ? adminCheck.message() : messageOf(publicCheck),
                claimed != null ? claimed : claimsOf(publicCheck));
    }

    @Override
    public String name() {
        return "provider-cookie";
    }

    private static VerifiedIdentity claimsOf(SessionCheckResponse response) {
        return response.user() != null && response.user().hasId() ? response.user().toIdentity() : null;
    }

    private static String messageOf(SessionCheckResponse response) {
        return response.message() != null ? response.message() : "Invalid session";
    }
}
