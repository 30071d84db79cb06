package com.linkdeck.linkservice.domain.user;

import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.UserNotFoundException;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application access approval. Users appear as pending on first sign-in; a super-admin grants
 * them a role, changes it, or revokes access again. The super-admin flag itself is not touched.
 */
public class UserAccessService {

    private static final Logger log = LoggerFactory.getLogger(UserAccessService.class);

    private final UserStore users;
    private final Clock clock;

    public UserAccessService(UserStore users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    public List<UserAccount> list(UserFilter filter) {
        return users.listAccounts(filter == null ? UserFilter.ALL : filter);
    }

    public AppRole grantAccess(String userId, String role) {
        AppRole granted = AppRole.grantable(role);
        requireUpdated(userId, users.updateAccess(userId, granted, AccessStatus.ACTIVE, true, clock.instant()));
        log.info("Granted {} access to user={}", granted.id(), LogRedactor.truncate(userId));
        return granted;
    }

    public void revokeAccess(String userId) {
        requireUpdated(userId, users.updateAccess(userId, AppRole.NONE, AccessStatus.REVOKED, false, clock.instant()));
        log.info("Revoked access of user={}", LogRedactor.truncate(userId));
    }

    public AppRole changeRole(String userId, String role) {
        AppRole changed = AppRole.grantable(role);
        requireUpdated(userId, users.updateAppRole(userId, changed, clock.instant()));
        log.info("User={} now has application role {}", LogRedactor.truncate(userId), changed.id());
        return changed;
    }

    private static void requireUpdated(String userId, boolean updated) {
        if (!updated) {
            throw new UserNotFoundException("No user found with userId: " + userId);
        }
    }
}
