package com.linkdeck.linkservice.api;

import com.linkdeck.linkservice.domain.user.AppRole;
import com.linkdeck.linkservice.domain.user.UserAccessService;
import com.linkdeck.linkservice.domain.user.UserAccount;
import com.linkdeck.linkservice.domain.user.UserFilter;
import com.linkdeck.linkservice.infrastructure.web.RequiresSuperAdmin;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Super-admin administration of local users and their application access. */
@RestController
@RequestMapping("/api/admin/users")
@RequiresSuperAdmin
public class AdminUserController {

    private final UserAccessService access;

    public AdminUserController(UserAccessService access) {
        this.access = access;
    }

    @GetMapping
    public Map<String, List<UserAccountResponse>> list(@RequestParam(required = false) String filter) {
        return Map.of("users", access.list(UserFilter.parse(filter)).stream()
                .map(UserAccountResponse::of)
                .toList());
    }

    @PostMapping("/{userId}/grant-access")
    public Map<String, Object> grant(@PathVariable String userId, @RequestBody RoleRequest request) {
        AppRole role = access.grantAccess(userId, request.role());
        return Map.of("success", true,
                "message", "Access granted successfully",
                "user", Map.of("userId", userId, "role", role.id(), "status", "active"));
    }

    @PostMapping("/{userId}/revoke-access")
    public Map<String, Object> revoke(@PathVariable String userId) {
        access.revokeAccess(userId);
        return Map.of("success", true, "message", "Access revoked successfully");
    }

    @PostMapping("/{userId}/change-role")
    public Map<String, Object> changeRole(@PathVariable String userId, @RequestBody RoleRequest request) {
        AppRole role = access.changeRole(userId, request.role());
        return Map.of("success", true,
                "message", "Role changed successfully",
                "user", Map.of("userId", userId, "role", role.id()));
    }

    public record RoleRequest(String role) {
    }

    public record UserAccountResponse(
            String userId,
            String email,
            String name,
            String identityRole,
            String appRole,
            String appStatus,
            boolean hasAccess,
            Instant createdAt,
            Instant lastLoginAt,
            Instant updatedAt) {

        static UserAccountResponse of(UserAccount account) {
            return new UserAccountResponse(account.userId(), account.email(), account.name(),
                    account.identityRole(), account.appRole().id(), account.appStatus().id(),
                    account.hasAccess(), account.createdAt(), account.lastLoginAt(), account.updatedAt());
        }
    }
}
