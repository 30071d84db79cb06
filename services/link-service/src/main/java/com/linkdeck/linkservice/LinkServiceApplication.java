package com.linkdeck.linkservice;

import com.linkdeck.linkservice.config.AuditProperties;
import com.linkdeck.linkservice.config.AuthorizationProperties;
import com.linkdeck.linkservice.config.IdentityProviderProperties;
import com.linkdeck.linkservice.config.LinkServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Linkdeck link service.
 *
 * <p>Validates identity-provider sessions, mirrors users locally and enforces organization-scoped
 * permissions in front of the organization, membership and role APIs.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation into logs and the audit executor
 *   <li>Error payloads of the form {@code {error, code, message}}
 *   <li>Scheduled role cache sweeping
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    LinkServiceProperties.class,
    IdentityProviderProperties.class,
    AuthorizationProperties.class,
    AuditProperties.class
})
public class LinkServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(LinkServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LinkServiceApplication.class, args);
        log.info("Linkdeck link service started");
    }
}
