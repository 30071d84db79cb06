package com.linkdeck.linkservice.infrastructure.persistence;

import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.instant;
import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.toTimestamp;

import com.linkdeck.linkservice.domain.organization.Organization;
import com.linkdeck.linkservice.domain.organization.OrganizationStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;

public class JdbcOrganizationStore implements OrganizationStore {

    private static final String COLUMNS = "id, slug, name, description, active, created_at, updated_at";

    private final JdbcClient jdbc;

    public JdbcOrganizationStore(JdbcClient jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(Organization organization) {
        jdbc.sql("""
                INSERT INTO organizations (id, slug, name, description, active, created_at, updated_at)
                VALUES (:id, :slug, :name, :description, :active, :createdAt, :updatedAt)
                """)
                .param("id", organization.id())
                .param("slug", organization.slug())
                .param("name", organization.name())
                .param("description", organization.description())
                .param("active", organization.active())
                .param("createdAt", toTimestamp(organization.createdAt()))
                .param("updatedAt", toTimestamp(organization.updatedAt()))
                .update();
    }

    @Override
    public Optional<Organization> findById(String id) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organizations WHERE id = :id")
                .param("id", id)
                .query(JdbcOrganizationStore::mapRow)
                .optional();
    }

    @Override
    public Optional<Organization> findBySlug(String slug) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organizations WHERE slug = :slug")
                .param("slug", slug)
                .query(JdbcOrganizationStore::mapRow)
                .optional();
    }

    @Override
    public boolean slugExists(String slug) {
        return jdbc.sql("SELECT COUNT(*) FROM organizations WHERE slug = :slug")
                .param("slug", slug)
                .query(Long.class)
                .single() > 0;
    }

    @Override
    public List<Organization> findActive() {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organizations WHERE active = TRUE ORDER BY created_at DESC")
                .query(JdbcOrganizationStore::mapRow)
                .list();
    }

    @Override
    public List<Organization> findActiveByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.sql("SELECT " + COLUMNS + " FROM organizations WHERE active = TRUE AND id IN (:ids) ORDER BY created_at DESC")
                .param("ids", List.copyOf(ids))
                .query(JdbcOrganizationStore::mapRow)
                .list();
    }

    private static Organization mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Organization(
                rs.getString("id"),
                rs.getString("slug"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getBoolean("active"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }
}
