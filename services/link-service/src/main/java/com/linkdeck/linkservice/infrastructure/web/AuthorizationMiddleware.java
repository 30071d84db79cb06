package com.linkdeck.linkservice.infrastructure.web;

import com.linkdeck.linkservice.domain.audit.AuditEvent;
import com.linkdeck.linkservice.domain.audit.AuditRecorder;
import com.linkdeck.linkservice.domain.organization.OrganizationContext;
import com.linkdeck.linkservice.domain.session.SessionValidator;
import com.linkdeck.observability.CorrelationContextHolder;
import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.AuthenticationFailureException;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.OrgContextMissingException;
import com.linkdeck.security.PermissionDeniedException;
import com.linkdeck.security.PermissionEngine;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * The two request gates: a valid session, then a permission in the request's organization.
 *
 * <p>{@link SessionInterceptor} and {@link OrgPermissionInterceptor} call these in that order. A
 * failed gate throws, and the handler never runs.
 */
public class AuthorizationMiddleware {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationMiddleware.class);

    /** Reported as the missing permission when a non-super-admin reaches a super-admin handler. */
    static final String SUPER_ADMIN = "superadmin";

    private final SessionValidator sessions;
    private final PermissionEngine permissions;
    private final OrganizationContextResolver organizations;
    private final AuditRecorder audit;
    private final Clock clock;

    public AuthorizationMiddleware(SessionValidator sessions, PermissionEngine permissions,
                                   OrganizationContextResolver organizations, AuditRecorder audit,
                                   Clock clock) {
        this.sessions = sessions;
        this.permissions = permissions;
        this.organizations = organizations;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Validates the session and attaches an {@link AuthContext} to the request. A request that
     * already passed keeps its context.
     *
     * @throws AuthenticationFailureException when the session is missing or invalid
     */
    public AuthContext requireSession(HttpServletRequest request) {
        var existing = AuthContext.from(request);
        if (existing.isPresent()) {
            return existing.get();
        }
        LocalUser user = sessions.validate(SessionRequests.from(request))
                .authenticatedUser()
                .orElseThrow(AuthenticationFailureException::new);

        AuthContext context = new AuthContext(user);
        request.setAttribute(AuthContext.ATTRIBUTE, context);
        CorrelationContextHolder.update(ctx -> ctx.withUser(user.externalId()));
        return context;
    }

    /**
     * Requires a session whose local user carries the super-admin flag.
     *
     * @throws AuthenticationFailureException when the session is missing or invalid
     * @throws PermissionDeniedException when the user is not a super-admin
     */
    public AuthContext requireSuperAdmin(HttpServletRequest request) {
        AuthContext context = requireSession(request);
        if (!context.user().superAdmin()) {
            log.info("Denied {} to user={}", SUPER_ADMIN, LogRedactor.truncate(context.userId()));
            audit.record(AuditEvent.denied(context.user(), SUPER_ADMIN,
                    SessionRequests.clientIp(request),
                    request.getHeader(HttpHeaders.USER_AGENT),
                    clock.instant()));
            throw new PermissionDeniedException(SUPER_ADMIN);
        }
        return context;
    }

    /**
     * Checks {@code permission} in the request's organization for the session's user and attaches
     * the organization and the caller's role to the {@link AuthContext}.
     *
     * @throws AuthenticationFailureException when no session was established
     * @throws OrgContextMissingException when no active organization can be resolved
     * @throws PermissionDeniedException when the caller lacks the permission
     */
    public AuthContext requirePermission(HttpServletRequest request, String permission) {
        AuthContext context = requireSession(request);
        OrganizationContext organization = organizations.resolve(request)
                .orElseThrow(OrgContextMissingException::new);
        String orgId = organization.organizationId();
        CorrelationContextHolder.update(ctx -> ctx.withOrg(orgId));

        if (!permissions.hasPermission(context.user(), orgId, permission, context.scope())) {
            log.info("Denied {} to user={} in org={}",
                    permission, LogRedactor.truncate(context.userId()), LogRedactor.truncate(orgId));
            audit.record(AuditEvent.denied(context.user(),
                    permission + " in org " + orgId,
                    SessionRequests.clientIp(request),
                    request.getHeader(HttpHeaders.USER_AGENT),
                    clock.instant()));
            throw new PermissionDeniedException(permission);
        }

        String role = permissions.resolveRole(context.user(), orgId, context.scope()).orElse(null);
        context.attachOrganization(organization, role);
        return context;
    }
}
