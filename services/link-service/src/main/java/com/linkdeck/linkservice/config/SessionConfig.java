package com.linkdeck.linkservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkdeck.linkservice.domain.audit.AuditRecorder;
import com.linkdeck.linkservice.domain.session.SessionStrategy;
import com.linkdeck.linkservice.domain.session.SessionValidator;
import com.linkdeck.linkservice.domain.user.UserStore;
import com.linkdeck.linkservice.infrastructure.identity.IdentityProviderClient;
import com.linkdeck.linkservice.infrastructure.identity.OAuthCookieSessionStrategy;
import com.linkdeck.linkservice.infrastructure.identity.ProviderCookieSessionStrategy;
import com.linkdeck.observability.MetricFactory;
import com.linkdeck.observability.SpanHelper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Session validation. The strategy is picked once, from {@code linkdeck.identity.strategy}.
 */
@Configuration(proxyBeanMethods = false)
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    IdentityProviderClient identityProviderClient(RestClient.Builder builder,
                                                  IdentityProviderProperties properties,
                                                  SpanHelper spans) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
        return new IdentityProviderClient(builder.requestFactory(requestFactory).build(), properties, spans);
    }

    @Bean
    SessionStrategy sessionStrategy(IdentityProviderProperties properties, IdentityProviderClient client,
                                    ObjectMapper objectMapper, Clock clock) {
        SessionStrategy strategy = switch (properties.strategy()) {
            case PROVIDER_COOKIE -> new ProviderCookieSessionStrategy(client);
            case OAUTH_COOKIE -> new OAuthCookieSessionStrategy(properties.sessionCookieName(), objectMapper, clock);
        };
        log.info("Session validation strategy: {}", strategy.name());
        return strategy;
    }

    @Bean
    SessionValidator sessionValidator(SessionStrategy strategy, UserStore users, AuditRecorder audit,
                                      MetricFactory metrics, Clock clock) {
        return new SessionValidator(strategy, users, audit, metrics, clock);
    }
}
