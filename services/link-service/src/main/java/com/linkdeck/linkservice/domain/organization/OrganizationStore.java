package com.linkdeck.linkservice.domain.organization;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OrganizationStore {

    void insert(Organization organization);

    Optional<Organization> findById(String id);

    Optional<Organization> findBySlug(String slug);

    boolean slugExists(String slug);

    List<Organization> findActive();

    List<Organization> findActiveByIds(Collection<String> ids);
}
