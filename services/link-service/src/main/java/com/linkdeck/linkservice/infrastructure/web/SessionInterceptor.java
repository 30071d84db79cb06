package com.linkdeck.linkservice.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the session gate for handlers marked {@link RequiresSession}, {@link RequiresSuperAdmin} or
 * {@link RequiresOrgPermission}, and the super-admin gate for the second. Registered before
 * {@link OrgPermissionInterceptor}.
 */
public class SessionInterceptor implements HandlerInterceptor {

    private final AuthorizationMiddleware middleware;

    public SessionInterceptor(AuthorizationMiddleware middleware) {
        this.middleware = middleware;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (handler instanceof HandlerMethod method) {
            if (requiresSuperAdmin(method)) {
                middleware.requireSuperAdmin(request);
            } else if (requiresSession(method)) {
                middleware.requireSession(request);
            }
        }
        return true;
    }

    static boolean requiresSession(HandlerMethod method) {
        return method.hasMethodAnnotation(RequiresSession.class)
                || method.hasMethodAnnotation(RequiresOrgPermission.class)
                || AnnotatedElementUtils.hasAnnotation(method.getBeanType(), RequiresSession.class);
    }

    static boolean requiresSuperAdmin(HandlerMethod method) {
        return method.hasMethodAnnotation(RequiresSuperAdmin.class)
                || AnnotatedElementUtils.hasAnnotation(method.getBeanType(), RequiresSuperAdmin.class);
    }
}
