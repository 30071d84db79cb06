package com.linkdeck.linkservice.domain.membership;

import com.linkdeck.linkservice.domain.user.UserStore;
import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.DomainException;
import com.linkdeck.security.ErrorCode;
import com.linkdeck.security.InvalidRoleException;
import com.linkdeck.security.LastAdminGuard;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.MemberNotFoundException;
import com.linkdeck.security.OrganizationLocks;
import com.linkdeck.security.PermissionDeniedException;
import com.linkdeck.security.PermissionSet;
import com.linkdeck.security.RoleResolver;
import com.linkdeck.security.SystemRole;
import com.linkdeck.security.UserNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Adds, re-roles, removes and lists organization members.
 *
 * <p>Demotions and removals run under the organization's lock and inside one transaction, so the
 * last-admin check and the write it protects cannot interleave with another demotion of the same
 * organization.
 *
 * <p>A caller may only assign a role whose permissions they hold themselves, and may only re-role
 * or remove a member whose current role they hold every permission of. Super-admins are exempt.
 */
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private static final Comparator<Membership> ADMINS_FIRST =
            Comparator.comparing((Membership m) -> !SystemRole.isAdmin(m.role()))
                    .thenComparing(Membership::addedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MembershipRepository members;
    private final UserStore users;
    private final RoleResolver roles;
    private final LastAdminGuard guard;
    private final OrganizationLocks locks;
    private final TransactionOperations tx;
    private final Clock clock;

    public MembershipService(MembershipRepository members, UserStore users, RoleResolver roles,
                             LastAdminGuard guard, OrganizationLocks locks,
                             TransactionOperations tx, Clock clock) {
        this.members = members;
        this.users = users;
        this.roles = roles;
        this.guard = guard;
        this.locks = locks;
        this.tx = tx;
        this.clock = clock;
    }

    public MemberView addMember(String orgId, AddMemberCommand command, Actor actor) {
        String email = trimToNull(command.email());
        String userId = trimToNull(command.userId());
        if (email == null && userId == null) {
            throw new DomainException(ErrorCode.MISSING_IDENTIFIER, "Either email or userId is required");
        }
        String role = requireAssignableRole(orgId, command.role());
        ensureCanGrant(orgId, actor, role);

        LocalUser target = (email != null ? users.findByEmail(email) : users.findById(userId))
                .orElseThrow(() -> new UserNotFoundException(email != null
                        ? "No user found with email: " + email
                        : "No user found with userId: " + userId));

        Instant now = clock.instant();
        Membership membership = new Membership(orgId, target.externalId(), role, actor.userId(), now, now);
        members.insert(membership);
        log.info("Added user={} to org={} as {}",
                LogRedactor.truncate(target.externalId()), LogRedactor.truncate(orgId), role);
        return MemberView.of(membership, target);
    }

    /**
     * Changes a member's role. Setting the role it already has returns the membership unchanged.
     */
    public MemberView changeRole(String orgId, String userId, String newRole, Actor actor) {
        String role = requireAssignableRole(orgId, newRole);
        ensureCanGrant(orgId, actor, role);
        Membership updated = locks.withLock(orgId, () -> tx.execute(status -> {
            Membership current = members.find(orgId, userId)
                    .orElseThrow(() -> new MemberNotFoundException(orgId));
            ensureCanGrant(orgId, actor, current.role());
            if (current.role().equals(role)) {
                return current;
            }
            if (SystemRole.isAdmin(current.role()) && !SystemRole.isAdmin(role)) {
                guard.ensureNotLastAdmin(orgId, userId, current.role(), "demote");
            }
            Instant now = clock.instant();
            members.updateRole(orgId, userId, role, now);
            return current.withRole(role, now);
        }));
        log.info("Member user={} of org={} now has role {}",
                LogRedactor.truncate(userId), LogRedactor.truncate(orgId), updated.role());
        return MemberView.of(updated, users.findById(userId).orElse(null));
    }

    public void removeMember(String orgId, String userId, Actor actor) {
        locks.withLock(orgId, () -> tx.execute(status -> {
            Membership current = members.find(orgId, userId)
                    .orElseThrow(() -> new MemberNotFoundException(orgId));
            ensureCanGrant(orgId, actor, current.role());
            guard.ensureNotLastAdmin(orgId, userId, current.role(), "remove");
            members.delete(orgId, userId);
            return current;
        }));
        log.info("Removed user={} from org={}", LogRedactor.truncate(userId), LogRedactor.truncate(orgId));
    }

    /** Admins first, then by join time. */
    public List<MemberView> listMembers(String orgId) {
        List<Membership> memberships = members.findByOrganization(orgId).stream()
                .sorted(ADMINS_FIRST)
                .toList();
        Map<String, LocalUser> profiles = users.findByIds(
                        memberships.stream().map(Membership::userId).toList()).stream()
                .collect(Collectors.toMap(LocalUser::externalId, Function.identity(), (a, b) -> a));
        return memberships.stream()
                .map(m -> MemberView.of(m, profiles.get(m.userId())))
                .toList();
    }

    private String requireAssignableRole(String orgId, String role) {
        String candidate = trimToNull(role);
        if (candidate == null) {
            throw new InvalidRoleException("Role is required");
        }
        if (SystemRole.isSystemRole(candidate) || roles.resolve(orgId, candidate).isPresent()) {
            return candidate;
        }
        throw new InvalidRoleException(
                "Role must be \"admin\", \"user\" or a role defined in this organization");
    }

    private void ensureCanGrant(String orgId, Actor actor, String roleId) {
        if (actor.superAdmin()) {
            return;
        }
        Set<String> required = roles.resolve(orgId, roleId).map(PermissionSet::permissions).orElse(Set.of());
        Set<String> held = Optional.ofNullable(actor.role())
                .flatMap(r -> roles.resolve(orgId, r))
                .map(PermissionSet::permissions)
                .orElse(Set.of());
        Optional<String> missing = required.stream().filter(p -> !held.contains(p)).sorted().findFirst();
        if (missing.isPresent()) {
            log.warn("Denied role '{}' in org={} to user={}: caller lacks {}",
                    roleId, LogRedactor.truncate(orgId), LogRedactor.truncate(actor.userId()), missing.get());
            throw new PermissionDeniedException(missing.get());
        }
    }

    private static String trimToNull(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        return s.trim();
    }
}
