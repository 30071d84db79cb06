package com.linkdeck.linkservice.config;

/** Which session strategy the service runs with. Chosen once at startup. */
public enum SessionStrategyType {

    /** Forward the cookie header to the identity provider's session endpoints. */
    PROVIDER_COOKIE,

    /** Decode the signed-in session cookie written by the OAuth callback. */
    OAUTH_COOKIE
}
