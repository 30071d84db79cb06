package com.linkdeck.linkservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity provider settings, bound from {@code linkdeck.identity.*}.
 *
 * <p>The session URLs are optional. A strategy that needs a URL which is not configured rejects
 * every session instead of failing startup.
 *
 * @param strategy session strategy, {@code provider-cookie} (default) or {@code oauth-cookie}
 * @param publicSessionUrl endpoint checking regular user sessions
 * @param adminSessionUrl endpoint checking admin sessions, tried when the public one says invalid
 * @param sessionCookieName cookie holding the OAuth session (default {@code sso_session})
 * @param userAgent user agent sent to the provider (default {@code linkdeck-client})
 * @param connectTimeout connect timeout for provider calls (default 5s)
 * @param readTimeout read timeout for provider calls (default 10s)
 */
@ConfigurationProperties(prefix = "linkdeck.identity")
@Validated
public record IdentityProviderProperties(
        SessionStrategyType strategy,
        String publicSessionUrl,
        String adminSessionUrl,
        String sessionCookieName,
        String userAgent,
        Duration connectTimeout,
        Duration readTimeout) {

    public IdentityProviderProperties {
        if (strategy == null) {
            strategy = SessionStrategyType.PROVIDER_COOKIE;
        }
        if (sessionCookieName == null || sessionCookieName.isBlank()) {
            sessionCookieName = "sso_session";
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = "linkdeck-client";
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(10);
        }
    }
}
