package com.linkdeck.linkservice.domain.session;

import com.linkdeck.linkservice.domain.audit.AuditEvent;
import com.linkdeck.linkservice.domain.audit.AuditRecorder;
import com.linkdeck.linkservice.domain.audit.AuditStatus;
import com.linkdeck.linkservice.domain.user.UserStore;
import com.linkdeck.observability.LogRedactor;
import com.linkdeck.observability.MetricFactory;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.SessionResult;
import com.linkdeck.security.SessionVerdict;
import com.linkdeck.security.VerifiedIdentity;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns inbound credentials into a {@link SessionResult}.
 *
 * <p>The active {@link SessionStrategy} is the only authority on validity. A verified identity is
 * mirrored into the local user store; if that write fails the session stays valid and the caller
 * gets a user built from the verified claims, without local privileges. Strategy failures fail
 * closed. Every outcome is audited without waiting for the write.
 */
public class SessionValidator {

    private static final Logger log = LoggerFactory.getLogger(SessionValidator.class);

    static final String VALIDATIONS_METRIC = "linkdeck.session.validations";

    private final SessionStrategy strategy;
    private final UserStore users;
    private final AuditRecorder audit;
    private final MetricFactory metrics;
    private final Clock clock;

    public SessionValidator(SessionStrategy strategy, UserStore users, AuditRecorder audit,
                            MetricFactory metrics, Clock clock) {
        this.strategy = strategy;
        this.users = users;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SessionResult validate(SessionRequest request) {
        SessionVerdict verdict;
        try {
            verdict = strategy.evaluate(request);
        } catch (RuntimeException e) {
            log.warn("Session validation via {} failed: {}", strategy.name(), e.getMessage());
            audit.record(AuditEvent.anonymous(AuditStatus.ERROR, e.getMessage(),
                    request.clientIp(), request.userAgent(), clock.instant()));
            count("error");
            return SessionResult.invalid();
        }

        if (!verdict.valid()) {
            log.debug("Session rejected by {}: {}", strategy.name(), verdict.message());
            audit.record(AuditEvent.rejected(verdict.identity(),
                    verdict.message() == null ? "Invalid session" : verdict.message(),
                    request.clientIp(), request.userAgent(), clock.instant()));
            count("invalid");
            return SessionResult.invalid();
        }

        LocalUser user = mirror(verdict.identity());
        audit.record(AuditEvent.success(user, request.clientIp(), request.userAgent(), clock.instant()));
        count("valid");
        return SessionResult.valid(user);
    }

    private LocalUser mirror(VerifiedIdentity identity) {
        try {
            return users.upsertFromIdentity(identity);
        } catch (RuntimeException e) {
            log.warn("Could not update local user={}; continuing with verified claims: {}",
                    LogRedactor.truncate(identity.id()), e.getMessage());
            return LocalUser.fromClaims(identity, clock.instant());
        }
    }

    private void count(String outcome) {
        metrics.increment(VALIDATIONS_METRIC, "Session validations by outcome", "outcome", outcome);
    }
}
