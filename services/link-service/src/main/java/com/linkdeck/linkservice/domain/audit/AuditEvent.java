package com.linkdeck.linkservice.domain.audit;

import com.linkdeck.security.LocalUser;
import com.linkdeck.security.VerifiedIdentity;
import java.time.Instant;

/**
 * One append-only audit record.
 *
 * @param userId provider user id, null when the caller was never identified
 * @param email caller email, when known
 * @param status outcome
 * @param message short explanation (provider message, error text, denied permission)
 * @param clientIp forwarded or remote client address
 * @param userAgent caller user agent
 * @param createdAt when the event happened
 */
public record AuditEvent(
        String userId,
        String email,
        AuditStatus status,
        String message,
        String clientIp,
        String userAgent,
        Instant createdAt) {

    public AuditEvent {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static AuditEvent success(LocalUser user, String clientIp, String userAgent, Instant at) {
        return new AuditEvent(user.externalId(), user.email(), AuditStatus.SUCCESS, null, clientIp, userAgent, at);
    }

    public static AuditEvent anonymous(AuditStatus status, String message, String clientIp, String userAgent, Instant at) {
        return new AuditEvent(null, null, status, message, clientIp, userAgent, at);
    }

    /** An INVALID session; carries the claims the rejected session still named, when there were any. */
    public static AuditEvent rejected(VerifiedIdentity claimed, String message, String clientIp, String userAgent,
                                      Instant at) {
        return new AuditEvent(claimed == null ? null : claimed.id(), claimed == null ? null : claimed.email(),
                AuditStatus.INVALID, message, clientIp, userAgent, at);
    }

    public static AuditEvent denied(LocalUser user, String message, String clientIp, String userAgent, Instant at) {
        return new AuditEvent(user.externalId(), user.email(), AuditStatus.DENIED, message, clientIp, userAgent, at);
    }
}
