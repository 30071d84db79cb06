package com.linkdeck.linkservice.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkdeck.linkservice.domain.session.SessionValidator;
import com.linkdeck.linkservice.infrastructure.web.SessionRequests;
import com.linkdeck.security.SessionResult;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets the browser ask whether its session is still valid. Always answers 200; the client reads
 * {@code isValid}.
 */
@RestController
@RequestMapping("/api/auth")
public class SessionController {

    private final SessionValidator sessions;

    public SessionController(SessionValidator sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/validate")
    public SessionStatus validate(HttpServletRequest request) {
        SessionResult result = sessions.validate(SessionRequests.from(request));
        return new SessionStatus(result.valid(), result.authenticatedUser().map(UserResponse::of).orElse(null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SessionStatus(@JsonProperty("isValid") boolean isValid, UserResponse user) {
    }
}
