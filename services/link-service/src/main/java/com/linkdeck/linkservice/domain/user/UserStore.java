package com.linkdeck.linkservice.domain.user;

import com.linkdeck.security.LocalUser;
import com.linkdeck.security.VerifiedIdentity;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Local mirror of identity-provider users. */
public interface UserStore {

    /**
     * Creates the user on first sight, otherwise refreshes profile fields and the login time.
     * {@code createdAt} and the local super-admin flag are never changed by this call.
     */
    LocalUser upsertFromIdentity(VerifiedIdentity identity);

    Optional<LocalUser> findById(String externalId);

    /** Case-insensitive lookup. */
    Optional<LocalUser> findByEmail(String email);

    List<LocalUser> findByIds(Collection<String> externalIds);

    /** Newest first. */
    List<UserAccount> listAccounts(UserFilter filter);

    /**
     * Sets the application role and status and whether the user has access.
     *
     * @return false when no such user exists
     */
    boolean updateAccess(String externalId, AppRole role, AccessStatus status, boolean hasAccess, Instant at);

    /**
     * Changes the application role only.
     *
     * @return false when no such user exists
     */
    boolean updateAppRole(String externalId, AppRole role, Instant at);
}
