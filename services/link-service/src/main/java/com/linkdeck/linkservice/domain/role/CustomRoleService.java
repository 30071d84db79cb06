package com.linkdeck.linkservice.domain.role;

import com.linkdeck.linkservice.domain.membership.MembershipRepository;
import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.InvalidRoleException;
import com.linkdeck.security.PermissionSet;
import com.linkdeck.security.Permissions;
import com.linkdeck.security.RoleNotFoundException;
import com.linkdeck.security.RoleResolver;
import com.linkdeck.security.SystemRole;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defines and deletes organization custom roles. Every change evicts the role from the
 * resolver's cache so the next permission check reads the new definition.
 */
public class CustomRoleService {

    private static final Logger log = LoggerFactory.getLogger(CustomRoleService.class);

    private static final Pattern ROLE_ID = Pattern.compile("[a-z0-9][a-z0-9_-]{0,63}");

    private final CustomRoleRepository roles;
    private final MembershipRepository members;
    private final RoleResolver resolver;
    private final Clock clock;

    public CustomRoleService(CustomRoleRepository roles, MembershipRepository members,
                             RoleResolver resolver, Clock clock) {
        this.roles = roles;
        this.members = members;
        this.resolver = resolver;
        this.clock = clock;
    }

    public PermissionSet define(String orgId, String roleId, Collection<String> permissions) {
        if (roleId == null || !ROLE_ID.matcher(roleId).matches()) {
            throw new InvalidRoleException("Role id must be lowercase letters, digits, '-' or '_'");
        }
        if (SystemRole.isSystemRole(roleId)) {
            throw new InvalidRoleException("'" + roleId + "' is a system role and cannot be redefined");
        }
        if (permissions == null || permissions.isEmpty()) {
            throw new InvalidRoleException("A role needs at least one permission");
        }
        List<String> unknown = permissions.stream().filter(p -> !Permissions.isKnown(p)).toList();
        if (!unknown.isEmpty()) {
            throw new InvalidRoleException("Unknown permissions: " + String.join(", ", unknown));
        }

        PermissionSet set = PermissionSet.copyOf(permissions);
        roles.save(orgId, roleId, set, clock.instant());
        resolver.invalidate(orgId, roleId);
        log.info("Defined role {} in org={} with {} permissions", roleId, LogRedactor.truncate(orgId), set.permissions().size());
        return set;
    }

    public void delete(String orgId, String roleId) {
        if (SystemRole.isSystemRole(roleId)) {
            throw new InvalidRoleException("'" + roleId + "' is a system role and cannot be deleted");
        }
        long holders = members.countByRole(orgId, roleId);
        if (holders > 0) {
            throw new InvalidRoleException(
                    "Role '" + roleId + "' is still assigned to " + holders + " member(s)");
        }
        if (roles.delete(orgId, roleId) == 0) {
            throw new RoleNotFoundException(orgId, roleId);
        }
        resolver.invalidate(orgId, roleId);
        log.info("Deleted role {} in org={}", roleId, LogRedactor.truncate(orgId));
    }

    public List<CustomRole> list(String orgId) {
        return roles.findByOrganization(orgId);
    }
}
