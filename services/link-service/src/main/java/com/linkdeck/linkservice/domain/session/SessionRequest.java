package com.linkdeck.linkservice.domain.session;

/**
 * The inbound credentials and caller details a session is validated from.
 *
 * @param cookieHeader raw {@code Cookie} header, forwarded verbatim (nullable)
 * @param userAgent caller user agent (nullable)
 * @param clientIp forwarded or remote client address (nullable)
 */
public record SessionRequest(String cookieHeader, String userAgent, String clientIp) {

    public boolean hasCookies() {
        return cookieHeader != null && !cookieHeader.isBlank();
    }
}
