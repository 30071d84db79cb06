package com.linkdeck.linkservice.infrastructure.web;

import com.linkdeck.linkservice.domain.organization.OrganizationContext;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.RequestScope;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * What the authorization interceptors learned about the caller, kept as a request attribute.
 *
 * <p>Holds the verified user and the request's membership memo from the session step; the
 * permission step adds the organization and the caller's role in it. Controllers receive it as a
 * method argument.
 */
public final class AuthContext {

    public static final String ATTRIBUTE = AuthContext.class.getName();

    private final LocalUser user;
    private final RequestScope scope = new RequestScope();
    private OrganizationContext organization;
    private String organizationRole;

    AuthContext(LocalUser user) {
        this.user = user;
    }

    public static Optional<AuthContext> from(HttpServletRequest request) {
        return Optional.ofNullable((AuthContext) request.getAttribute(ATTRIBUTE));
    }

    public LocalUser user() {
        return user;
    }

    public String userId() {
        return user.externalId();
    }

    public RequestScope scope() {
        return scope;
    }

    public Optional<OrganizationContext> organization() {
        return Optional.ofNullable(organization);
    }

    /** The caller's role in {@link #organization()}; empty for a super-admin who is not a member. */
    public Optional<String> organizationRole() {
        return Optional.ofNullable(organizationRole);
    }

    void attachOrganization(OrganizationContext organization, String role) {
        this.organization = organization;
        this.organizationRole = role;
    }
}
