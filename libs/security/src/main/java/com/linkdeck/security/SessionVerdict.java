package com.linkdeck.security;

/**
 * Outcome of asking a session strategy whether the inbound credentials are valid.
 *
 * @param valid    whether the provider accepted the session
 * @param identity verified claims when valid; when invalid, the unverified claims the rejected
 *                 session still named, if any (never used for authorization)
 * @param message  provider or strategy message explaining a rejection (nullable)
 */
public record SessionVerdict(boolean valid, VerifiedIdentity identity, String message) {

    public SessionVerdict {
        if (valid && (identity == null || identity.id() == null || identity.id().isBlank())) {
            throw new IllegalArgumentException("a valid verdict requires an identity with an id");
        }
    }

    public static SessionVerdict verified(VerifiedIdentity identity) {
        return new SessionVerdict(true, identity, null);
    }

    public static SessionVerdict rejected(String message) {
        return new SessionVerdict(false, null, message);
    }

    public static SessionVerdict rejected(String message, VerifiedIdentity claimed) {
        return new SessionVerdict(false, claimed, message);
    }
}
