package com.linkdeck.linkservice.domain.membership;

import com.linkdeck.security.DuplicateMemberException;
import com.linkdeck.security.MembershipStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Full membership storage; the read side used by authorization is {@link MembershipStore}. */
public interface MembershipRepository extends MembershipStore {

    Optional<Membership> find(String orgId, String userId);

    List<Membership> findByOrganization(String orgId);

    List<Membership> findByUser(String userId);

    /**
     * Inserts a new membership.
     *
     * @throws DuplicateMemberException when the user already belongs to the organization
     */
    void insert(Membership membership);

    /** @return rows changed */
    int updateRole(String orgId, String userId, String role, Instant at);

    /** @return rows removed */
    int delete(String orgId, String userId);

    long countByRole(String orgId, String roleId);
}
