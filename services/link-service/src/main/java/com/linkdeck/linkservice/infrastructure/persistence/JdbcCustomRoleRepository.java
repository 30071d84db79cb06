package com.linkdeck.linkservice.infrastructure.persistence;

import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.instant;
import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.toTimestamp;

import com.linkdeck.linkservice.domain.role.CustomRole;
import com.linkdeck.linkservice.domain.role.CustomRoleRepository;
import com.linkdeck.security.PermissionSet;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link CustomRoleRepository} over {@code custom_roles}. Permissions are stored as one
 * comma-separated column.
 */
public class JdbcCustomRoleRepository implements CustomRoleRepository {

    private final JdbcClient jdbc;

    public JdbcCustomRoleRepository(JdbcClient jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<PermissionSet> findPermissions(String orgId, String roleId) {
        return jdbc.sql("SELECT permissions FROM custom_roles WHERE org_id = :orgId AND role_id = :roleId")
                .param("orgId", orgId)
                .param("roleId", roleId)
                .query(String.class)
                .optional()
                .map(JdbcCustomRoleRepository::parse);
    }

    @Override
    public void save(String orgId, String roleId, PermissionSet permissions, Instant at) {
        String joined = String.join(",", new TreeSet<>(permissions.permissions()));
        int updated = jdbc.sql("""
                UPDATE custom_roles SET permissions = :permissions, updated_at = :at
                 WHERE org_id = :orgId AND role_id = :roleId
                """)
                .param("permissions", joined)
                .param("at", toTimestamp(at))
                .param("orgId", orgId)
                .param("roleId", roleId)
                .update();
        if (updated == 0) {
            jdbc.sql("""
                    INSERT INTO custom_roles (org_id, role_id, permissions, created_at, updated_at)
                    VALUES (:orgId, :roleId, :permissions, :at, :at)
                    """)
                    .param("orgId", orgId)
                    .param("roleId", roleId)
                    .param("permissions", joined)
                    .param("at", toTimestamp(at))
                    .update();
        }
    }

    @Override
    public int delete(String orgId, String roleId) {
        return jdbc.sql("DELETE FROM custom_roles WHERE org_id = :orgId AND role_id = :roleId")
                .param("orgId", orgId)
                .param("roleId", roleId)
                .update();
    }

    @Override
    public List<CustomRole> findByOrganization(String orgId) {
        return jdbc.sql("""
                SELECT org_id, role_id, permissions, created_at, updated_at
                  FROM custom_roles WHERE org_id = :orgId ORDER BY role_id
                """)
                .param("orgId", orgId)
                .query(JdbcCustomRoleRepository::mapRow)
                .list();
    }

    private static CustomRole mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new CustomRole(
                rs.getString("org_id"),
                rs.getString("role_id"),
                parse(rs.getString("permissions")),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    private static PermissionSet parse(String joined) {
        if (joined == null || joined.isBlank()) {
            return PermissionSet.of();
        }
        return PermissionSet.copyOf(Arrays.stream(joined.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList());
    }
}
