package com.linkdeck.linkservice.api;

import com.linkdeck.linkservice.domain.membership.Actor;
import com.linkdeck.linkservice.domain.membership.AddMemberCommand;
import com.linkdeck.linkservice.domain.membership.MemberView;
import com.linkdeck.linkservice.domain.membership.MembershipService;
import com.linkdeck.linkservice.infrastructure.web.AuthContext;
import com.linkdeck.linkservice.infrastructure.web.RequiresOrgPermission;
import com.linkdeck.security.Permissions;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Organization member management. */
@RestController
@RequestMapping("/api/organizations/{orgId}/members")
public class MemberController {

    private final MembershipService memberships;

    public MemberController(MembershipService memberships) {
        this.memberships = memberships;
    }

    @GetMapping
    @RequiresOrgPermission(Permissions.MEMBERS_READ)
    public Map<String, List<MemberView>> list(@PathVariable String orgId) {
        return Map.of("members", memberships.listMembers(orgId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresOrgPermission(Permissions.MEMBERS_WRITE)
    public Map<String, Object> add(@PathVariable String orgId, @RequestBody AddMemberRequest request,
                                   AuthContext auth) {
        MemberView member = memberships.addMember(orgId,
                new AddMemberCommand(request.email(), request.userId(), request.role()), actor(auth));
        return Map.of("message", "Member added successfully", "member", member);
    }

    @PatchMapping("/{userId}")
    @RequiresOrgPermission(Permissions.MEMBERS_WRITE)
    public Map<String, Object> changeRole(@PathVariable String orgId, @PathVariable String userId,
                                          @RequestBody ChangeRoleRequest request, AuthContext auth) {
        MemberView member = memberships.changeRole(orgId, userId, request.role(), actor(auth));
        return Map.of("message", "Member role updated", "member", member);
    }

    @DeleteMapping("/{userId}")
    @RequiresOrgPermission(Permissions.MEMBERS_WRITE)
    public Map<String, Object> remove(@PathVariable String orgId, @PathVariable String userId,
                                      AuthContext auth) {
        memberships.removeMember(orgId, userId, actor(auth));
        return Map.of("message", "Member removed", "removedMember", Map.of("userId", userId));
    }

    private static Actor actor(AuthContext auth) {
        return new Actor(auth.userId(), auth.organizationRole().orElse(null), auth.user().superAdmin());
    }

    public record AddMemberRequest(String email, String userId, String role) {
    }

    public record ChangeRoleRequest(String role) {
    }
}
