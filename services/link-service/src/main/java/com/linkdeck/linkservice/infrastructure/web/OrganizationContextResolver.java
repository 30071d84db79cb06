package com.linkdeck.linkservice.infrastructure.web;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.linkdeck.linkservice.domain.organization.Organization;
import com.linkdeck.linkservice.domain.organization.OrganizationContext;
import com.linkdeck.linkservice.domain.organization.OrganizationStore;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Works out which organization a request targets.
 *
 * <p>A route that names the organization in its path ({@code {orgId}}) is authoritative. Otherwise
 * the id header beats the id query parameter, and an id beats a slug given as header or query
 * parameter. The organization must exist and be active. Slug lookups are cached for a short TTL;
 * unknown slugs are not cached.
 */
public class OrganizationContextResolver {

    private static final Logger log = LoggerFactory.getLogger(OrganizationContextResolver.class);

    public static final String ORG_ID_HEADER = "X-Organization-UUID";
    public static final String ORG_SLUG_HEADER = "X-Organization-Slug";
    public static final String ORG_ID_PARAM = "orgUuid";
    public static final String ORG_SLUG_PARAM = "orgSlug";
    public static final String ORG_ID_PATH_VARIABLE = "orgId";

    private final OrganizationStore organizations;
    private final Cache<String, Organization> bySlug;

    public OrganizationContextResolver(OrganizationStore organizations, Duration slugTtl) {
        this(organizations, slugTtl, Ticker.systemTicker());
    }

    public OrganizationContextResolver(OrganizationStore organizations, Duration slugTtl, Ticker ticker) {
        this.organizations = organizations;
        this.bySlug = Caffeine.newBuilder()
                .expireAfterWrite(slugTtl)
                .maximumSize(10_000)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<OrganizationContext> resolve(HttpServletRequest request) {
        try {
            String pathId = pathVariable(request);
            if (pathId != null) {
                return active(organizations.findById(pathId));
            }
            String id = firstNonBlank(request.getHeader(ORG_ID_HEADER), request.getParameter(ORG_ID_PARAM));
            if (id != null) {
                return active(organizations.findById(id));
            }
            String slug = firstNonBlank(request.getHeader(ORG_SLUG_HEADER), request.getParameter(ORG_SLUG_PARAM));
            if (slug != null) {
                String normalized = slug.toLowerCase(Locale.ROOT);
                return active(Optional.ofNullable(
                        bySlug.get(normalized, s -> organizations.findBySlug(s).orElse(null))));
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Organization context lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Drops a cached slug, e.g. after the organization was deactivated. */
    public void evictSlug(String slug) {
        if (slug != null) {
            bySlug.invalidate(slug.toLowerCase(Locale.ROOT));
        }
    }

    private static Optional<OrganizationContext> active(Optional<Organization> organization) {
        return organization.filter(Organization::active).map(OrganizationContext::of);
    }

    @SuppressWarnings("unchecked")
    private static String pathVariable(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            return firstNonBlank(((Map<String, String>) map).get(ORG_ID_PATH_VARIABLE));
        }
        return null;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }
}
