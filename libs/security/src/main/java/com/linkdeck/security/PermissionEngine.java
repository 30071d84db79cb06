package com.linkdeck.security;

import com.linkdeck.observability.LogRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Answers "may user U perform permission P in organization O".
 * <p>
 * Evaluation order:
 * <ol>
 *   <li>super-admin ⇒ granted, nothing else is read</li>
 *   <li>missing user, organization or permission ⇒ denied</li>
 *   <li>membership role, taken from the {@link RequestScope} memo when one is supplied</li>
 *   <li>non-member ⇒ denied</li>
 *   <li>role resolved through {@link RoleResolver}; an unresolvable role is a data
 *       consistency problem, logged, and denied</li>
 *   <li>permission set membership test</li>
 * </ol>
 * Every evaluation is reported to the {@link PermissionCheckListener}.
 */
public class PermissionEngine {

    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    /** Default duration above which a check counts as slow. */
    public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofMillis(100);

    private final MembershipStore memberships;
    private final RoleResolver roleResolver;
    private final PermissionCheckListener listener;
    private final Duration slowThreshold;

    public PermissionEngine(MembershipStore memberships, RoleResolver roleResolver) {
        this(memberships, roleResolver, PermissionCheckListener.NONE, DEFAULT_SLOW_THRESHOLD);
    }

    public PermissionEngine(MembershipStore memberships,
                            RoleResolver roleResolver,
                            PermissionCheckListener listener,
                            Duration slowThreshold) {
        this.memberships = memberships;
        this.roleResolver = roleResolver;
        this.listener = listener == null ? PermissionCheckListener.NONE : listener;
        this.slowThreshold = slowThreshold == null ? DEFAULT_SLOW_THRESHOLD : slowThreshold;
    }

    /**
     * Checks one permission without a request memo.
     */
    public boolean hasPermission(LocalUser user, String orgId, String permission) {
        return hasPermission(user, orgId, permission, null);
    }

    /**
     * Checks one permission.
     *
     * @param user       the verified caller (nullable)
     * @param orgId      organization the action targets
     * @param permission permission string, e.g. {@code cards.write}
     * @param scope      per-request memo, or null to always read membership storage
     * @return true only when the caller is a super-admin or their role grants the permission
     */
    public boolean hasPermission(LocalUser user, String orgId, String permission, RequestScope scope) {
        long started = System.nanoTime();
        boolean granted = false;
        boolean memoHit = false;
        try {
            if (user != null && user.superAdmin()) {
                granted = true;
                return true;
            }
            if (user == null || isBlank(user.externalId()) || isBlank(orgId) || isBlank(permission)) {
                return false;
            }

            String userId = user.externalId();
            memoHit = scope != null && scope.contains(userId, orgId);
            Optional<String> role = lookupRole(userId, orgId, scope);
            if (role.isEmpty()) {
                log.debug("Denied {}: user={} is not a member of org={}",
                        permission, LogRedactor.truncate(userId), LogRedactor.truncate(orgId));
                return false;
            }

            Optional<PermissionSet> permissions = roleResolver.resolve(orgId, role.get());
            if (permissions.isEmpty()) {
                log.warn("Data consistency: membership of user={} in org={} references unknown role '{}'; denying",
                        LogRedactor.truncate(userId), LogRedactor.truncate(orgId), role.get());
                return false;
            }

            granted = permissions.get().allows(permission);
            return granted;
        } finally {
            publish(permission, granted, memoHit, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /**
     * Returns the caller's role in the organization, reusing the memo when present.
     * Super-admins who are not members get an empty result.
     */
    public Optional<String> resolveRole(LocalUser user, String orgId, RequestScope scope) {
        if (user == null || isBlank(user.externalId()) || isBlank(orgId)) {
            return Optional.empty();
        }
        return lookupRole(user.externalId(), orgId, scope);
    }

    private Optional<String> lookupRole(String userId, String orgId, RequestScope scope) {
        if (scope != null && scope.contains(userId, orgId)) {
            return scope.role(userId, orgId);
        }
        Optional<String> role;
        try {
            role = memberships.findRole(orgId, userId);
        } catch (RuntimeException e) {
            // not memoized, so a later check in the same request reads again
            log.error("Membership lookup failed for user={} org={}; treating as non-member",
                    LogRedactor.truncate(userId), LogRedactor.truncate(orgId), e);
            return Optional.empty();
        }
        if (scope != null) {
            scope.remember(userId, orgId, role);
        }
        return role;
    }

    private void publish(String permission, boolean granted, boolean memoHit, Duration duration) {
        boolean slow = duration.compareTo(slowThreshold) > 0;
        if (slow) {
            log.warn("Slow permission check: {} took {} ms", permission, duration.toMillis());
        }
        try {
            listener.onCheck(new PermissionCheck(permission, granted, memoHit, duration, slow));
        } catch (RuntimeException e) {
            log.warn("Permission check listener failed", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
