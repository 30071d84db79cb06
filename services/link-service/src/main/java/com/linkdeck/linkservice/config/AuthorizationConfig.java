package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.domain.audit.AuditRecorder;
import com.linkdeck.linkservice.domain.organization.OrganizationStore;
import com.linkdeck.linkservice.domain.role.CustomRoleRepository;
import com.linkdeck.linkservice.domain.session.SessionValidator;
import com.linkdeck.linkservice.infrastructure.metrics.MicrometerPermissionCheckListener;
import com.linkdeck.linkservice.infrastructure.web.AuthorizationMiddleware;
import com.linkdeck.linkservice.infrastructure.web.OrganizationContextResolver;
import com.linkdeck.observability.MetricFactory;
import com.linkdeck.security.CaffeineRoleCache;
import com.linkdeck.security.LastAdminGuard;
import com.linkdeck.security.MembershipStore;
import com.linkdeck.security.OrganizationLocks;
import com.linkdeck.security.PermissionEngine;
import com.linkdeck.security.RoleCache;
import com.linkdeck.security.RoleResolver;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the authorization core from {@code com.linkdeck.security} into the service. */
@Configuration(proxyBeanMethods = false)
public class AuthorizationConfig {

    @Bean
    RoleCache roleCache(AuthorizationProperties properties) {
        return new CaffeineRoleCache(properties.roleCacheTtl(), properties.roleCacheMaxSize());
    }

    @Bean
    RoleResolver roleResolver(CustomRoleRepository roles, RoleCache cache) {
        return new RoleResolver(roles, cache);
    }

    @Bean
    PermissionEngine permissionEngine(MembershipStore memberships, RoleResolver resolver,
                                      MetricFactory metrics, AuthorizationProperties properties) {
        return new PermissionEngine(memberships, resolver,
                new MicrometerPermissionCheckListener(metrics), properties.slowCheckThreshold());
    }

    @Bean
    LastAdminGuard lastAdminGuard(MembershipStore memberships) {
        return new LastAdminGuard(memberships);
    }

    @Bean
    OrganizationLocks organizationLocks() {
        return new OrganizationLocks();
    }

    @Bean
    OrganizationContextResolver organizationContextResolver(OrganizationStore organizations,
                                                            AuthorizationProperties properties) {
        return new OrganizationContextResolver(organizations, properties.orgSlugCacheTtl());
    }

    @Bean
    AuthorizationMiddleware authorizationMiddleware(SessionValidator sessions, PermissionEngine engine,
                                                    OrganizationContextResolver organizations,
                                                    AuditRecorder audit, Clock clock) {
        return new AuthorizationMiddleware(sessions, engine, organizations, audit, clock);
    }
}
