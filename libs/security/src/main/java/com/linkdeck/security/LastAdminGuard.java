package com.linkdeck.security;

import com.linkdeck.observability.LogRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks demotion or removal of an organization's last remaining admin.
 * <p>
 * The check reads the current admin count and decides; it does not lock anything. Callers
 * mutate memberships inside {@link OrganizationLocks#withLock} so that two concurrent
 * demotions in one organization cannot both pass on a stale count.
 */
public class LastAdminGuard {

    private static final Logger log = LoggerFactory.getLogger(LastAdminGuard.class);

    private final MembershipStore memberships;

    public LastAdminGuard(MembershipStore memberships) {
        this.memberships = memberships;
    }

    /**
     * @param orgId       organization being modified
     * @param userId      member being demoted or removed
     * @param currentRole that member's current role
     * @return true when the member is an admin and at most one admin exists; a failed count
     *         is treated as zero admins
     */
    public boolean wouldOrphanOrg(String orgId, String userId, String currentRole) {
        if (!SystemRole.isAdmin(currentRole)) {
            return false;
        }
        long admins;
        try {
            admins = memberships.countAdmins(orgId);
        } catch (RuntimeException e) {
            log.error("Admin count failed for org={}; blocking change to user={}",
                    LogRedactor.truncate(orgId), LogRedactor.truncate(userId), e);
            admins = 0;
        }
        return admins <= 1;
    }

    /**
     * Throws when {@link #wouldOrphanOrg} is true.
     *
     * @param action verb used in the error message ("demote", "remove")
     * @throws LastAdminProtectionException if the change would leave no admin
     */
    public void ensureNotLastAdmin(String orgId, String userId, String currentRole, String action) {
        if (wouldOrphanOrg(orgId, userId, currentRole)) {
            log.info("Rejected {} of last admin user={} in org={}",
                    action, LogRedactor.truncate(userId), LogRedactor.truncate(orgId));
            throw new LastAdminProtectionException(orgId, userId, action);
        }
    }
}
