package com.linkdeck.linkservice.api;

import com.linkdeck.linkservice.domain.organization.CreateOrganizationCommand;
import com.linkdeck.linkservice.domain.organization.Organization;
import com.linkdeck.linkservice.domain.organization.OrganizationMembership;
import com.linkdeck.linkservice.domain.organization.OrganizationService;
import com.linkdeck.linkservice.infrastructure.web.AuthContext;
import com.linkdeck.linkservice.infrastructure.web.RequiresSession;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Lists and creates organizations. Any signed-in user may call these. */
@RestController
@RequestMapping("/api/organizations")
@RequiresSession
public class OrganizationController {

    private final OrganizationService organizations;

    public OrganizationController(OrganizationService organizations) {
        this.organizations = organizations;
    }

    @GetMapping
    public Map<String, List<OrganizationResponse>> list(AuthContext auth) {
        return Map.of("organizations", organizations.listForUser(auth.user()).stream()
                .map(OrganizationResponse::of)
                .toList());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, OrganizationResponse> create(@Valid @RequestBody CreateOrganizationRequest request,
                                                    AuthContext auth) {
        Organization created = organizations.create(
                new CreateOrganizationCommand(request.name(), request.slug(), request.description()),
                auth.user());
        return Map.of("organization", OrganizationResponse.of(new OrganizationMembership(created, "admin")));
    }

    public record CreateOrganizationRequest(
            @NotBlank @Size(max = 255) String name,
            @NotBlank @Size(max = 128) String slug,
            @Size(max = 2000) String description) {
    }

    public record OrganizationResponse(
            String id,
            String slug,
            String name,
            String description,
            boolean active,
            Instant createdAt,
            Instant updatedAt,
            String userRole) {

        static OrganizationResponse of(OrganizationMembership entry) {
            Organization org = entry.organization();
            return new OrganizationResponse(org.id(), org.slug(), org.name(), org.description(),
                    org.active(), org.createdAt(), org.updatedAt(), entry.role());
        }
    }
}
