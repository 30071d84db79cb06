package com.linkdeck.linkservice.infrastructure.web;

import com.linkdeck.linkservice.domain.session.SessionRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/** Builds {@link SessionRequest}s from servlet requests. */
public final class SessionRequests {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private SessionRequests() {
    }

    public static SessionRequest from(HttpServletRequest request) {
        return new SessionRequest(
                request.getHeader(HttpHeaders.COOKIE),
                request.getHeader(HttpHeaders.USER_AGENT),
                clientIp(request));
    }

    /** First {@code X-Forwarded-For} hop, else the remote address. */
    public static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
