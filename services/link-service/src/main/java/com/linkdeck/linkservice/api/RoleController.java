package com.linkdeck.linkservice.api;

import com.linkdeck.linkservice.domain.role.CustomRoleService;
import com.linkdeck.linkservice.infrastructure.web.RequiresOrgPermission;
import com.linkdeck.security.PermissionSet;
import com.linkdeck.security.Permissions;
import com.linkdeck.security.SystemRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** System and custom roles of an organization. */
@RestController
@RequestMapping("/api/organizations/{orgId}/roles")
public class RoleController {

    private final CustomRoleService roles;

    public RoleController(CustomRoleService roles) {
        this.roles = roles;
    }

    @GetMapping
    @RequiresOrgPermission(Permissions.ORG_READ)
    public Map<String, List<RoleResponse>> list(@PathVariable String orgId) {
        List<RoleResponse> all = new ArrayList<>();
        for (SystemRole role : SystemRole.values()) {
            all.add(RoleResponse.of(role.id(), role.permissions(), true));
        }
        roles.list(orgId).forEach(role -> all.add(RoleResponse.of(role.roleId(), role.permissions(), false)));
        return Map.of("roles", all);
    }

    @PutMapping("/{roleId}")
    @RequiresOrgPermission(Permissions.ORG_WRITE)
    public Map<String, RoleResponse> define(@PathVariable String orgId, @PathVariable String roleId,
                                            @RequestBody DefineRoleRequest request) {
        PermissionSet permissions = roles.define(orgId, roleId, request.permissions());
        return Map.of("role", RoleResponse.of(roleId, permissions, false));
    }

    @DeleteMapping("/{roleId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresOrgPermission(Permissions.ORG_WRITE)
    public void delete(@PathVariable String orgId, @PathVariable String roleId) {
        roles.delete(orgId, roleId);
    }

    public record DefineRoleRequest(List<String> permissions) {
    }

    public record RoleResponse(String roleId, Set<String> permissions, boolean system) {

        static RoleResponse of(String roleId, PermissionSet permissions, boolean system) {
            return new RoleResponse(roleId, new TreeSet<>(permissions.permissions()), system);
        }
    }
}
