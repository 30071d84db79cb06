package com.linkdeck.linkservice.domain.organization;

import com.linkdeck.linkservice.domain.membership.Membership;
import com.linkdeck.linkservice.domain.membership.MembershipRepository;
import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.DomainException;
import com.linkdeck.security.ErrorCode;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.SystemRole;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionOperations;

/** Creates organizations and lists the ones a user can see. */
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    static final Pattern SLUG = Pattern.compile("[a-z0-9-]{2,}");

    private final OrganizationStore organizations;
    private final MembershipRepository members;
    private final TransactionOperations tx;
    private final Clock clock;

    public OrganizationService(OrganizationStore organizations, MembershipRepository members,
                               TransactionOperations tx, Clock clock) {
        this.organizations = organizations;
        this.members = members;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Creates an active organization with the creator as its first admin.
     *
     * @throws DomainException {@code INVALID_REQUEST} for a missing name or malformed slug,
     *                         {@code SLUG_CONFLICT} when the slug is taken
     */
    public Organization create(CreateOrganizationCommand command, LocalUser creator) {
        String name = command.name() == null ? "" : command.name().trim();
        if (name.isEmpty()) {
            throw new DomainException(ErrorCode.INVALID_REQUEST, "Organization name is required");
        }
        String slug = normalizeSlug(command.slug());
        if (!SLUG.matcher(slug).matches()) {
            throw new DomainException(ErrorCode.INVALID_REQUEST,
                    "Slug must be at least 2 characters of lowercase letters, digits or hyphens");
        }
        if (organizations.slugExists(slug)) {
            throw slugConflict(slug);
        }

        Instant now = clock.instant();
        Organization organization = new Organization(
                UUID.randomUUID().toString(), slug, name, command.description(), true, now, now);
        try {
            tx.executeWithoutResult(status -> {
                organizations.insert(organization);
                members.insert(new Membership(organization.id(), creator.externalId(),
                        SystemRole.ADMIN.id(), creator.externalId(), now, now));
            });
        } catch (DuplicateKeyException e) {
            throw slugConflict(slug);
        }
        log.info("Created org={} slug={} by user={}",
                LogRedactor.truncate(organization.id()), slug, LogRedactor.truncate(creator.externalId()));
        return organization;
    }

    /**
     * Super-admins see every active organization; everyone else sees the active organizations
     * they belong to. Each entry carries the user's role, if any.
     */
    public List<OrganizationMembership> listForUser(LocalUser user) {
        Map<String, String> roles = members.findByUser(user.externalId()).stream()
                .collect(Collectors.toMap(Membership::organizationId, Membership::role, (a, b) -> a));
        List<Organization> visible = user.superAdmin()
                ? organizations.findActive()
                : organizations.findActiveByIds(roles.keySet());
        return visible.stream()
                .map(org -> new OrganizationMembership(org, roles.get(org.id())))
                .toList();
    }

    static String normalizeSlug(String slug) {
        return slug == null ? "" : slug.trim().toLowerCase(Locale.ROOT);
    }

    private static DomainException slugConflict(String slug) {
        return new DomainException(ErrorCode.SLUG_CONFLICT, "Slug '" + slug + "' is already in use");
    }
}
