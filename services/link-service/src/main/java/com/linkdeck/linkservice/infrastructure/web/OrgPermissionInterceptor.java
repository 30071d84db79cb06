package com.linkdeck.linkservice.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/** Runs the permission gate for handlers marked {@link RequiresOrgPermission}. */
public class OrgPermissionInterceptor implements HandlerInterceptor {

    private final AuthorizationMiddleware middleware;

    public OrgPermissionInterceptor(AuthorizationMiddleware middleware) {
        this.middleware = middleware;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (handler instanceof HandlerMethod method) {
            RequiresOrgPermission required = method.getMethodAnnotation(RequiresOrgPermission.class);
            if (required != null) {
                middleware.requirePermission(request, required.value());
            }
        }
        return true;
    }
}
