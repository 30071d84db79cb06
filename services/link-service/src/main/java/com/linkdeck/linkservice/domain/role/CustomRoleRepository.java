package com.linkdeck.linkservice.domain.role;

import com.linkdeck.security.PermissionSet;
import com.linkdeck.security.RoleStore;
import java.time.Instant;
import java.util.List;

/** Custom role storage; the read side used by role resolution is {@link RoleStore}. */
public interface CustomRoleRepository extends RoleStore {

    /** Inserts or replaces the role's permission set. */
    void save(String orgId, String roleId, PermissionSet permissions, Instant at);

    /** @return rows removed */
    int delete(String orgId, String roleId);

    List<CustomRole> findByOrganization(String orgId);
}
