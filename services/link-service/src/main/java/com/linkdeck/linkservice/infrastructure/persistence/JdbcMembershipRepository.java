package com.linkdeck.linkservice.infrastructure.persistence;

import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.instant;
import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.toTimestamp;

import com.linkdeck.linkservice.domain.membership.Membership;
import com.linkdeck.linkservice.domain.membership.MembershipRepository;
import com.linkdeck.security.DuplicateMemberException;
import com.linkdeck.security.SystemRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

/** {@link MembershipRepository} over {@code organization_members}, keyed by (org_id, user_id). */
public class JdbcMembershipRepository implements MembershipRepository {

    private static final String COLUMNS = "org_id, user_id, role, added_by, added_at, updated_at";

    private final JdbcClient jdbc;

    public JdbcMembershipRepository(JdbcClient jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<String> findRole(String orgId, String userId) {
        return jdbc.sql("SELECT role FROM organization_members WHERE org_id = :orgId AND user_id = :userId")
                .param("orgId", orgId)
                .param("userId", userId)
                .query(String.class)
                .optional();
    }

    @Override
    public long countAdmins(String orgId) {
        return countByRole(orgId, SystemRole.ADMIN.id());
    }

    @Override
    public long countByRole(String orgId, String roleId) {
        return jdbc.sql("SELECT COUNT(*) FROM organization_members WHERE org_id = :orgId AND role = :role")
                .param("orgId", orgId)
                .param("role", roleId)
                .query(Long.class)
                .single();
    }

    @Override
    public Optional<Membership> find(String orgId, String userId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organization_members WHERE org_id = :orgId AND user_id = :userId")
                .param("orgId", orgId)
                .param("userId", userId)
                .query(JdbcMembershipRepository::mapRow)
                .optional();
    }

    @Override
    public List<Membership> findByOrganization(String orgId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organization_members WHERE org_id = :orgId")
                .param("orgId", orgId)
                .query(JdbcMembershipRepository::mapRow)
                .list();
    }

    @Override
    public List<Membership> findByUser(String userId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM organization_members WHERE user_id = :userId")
                .param("userId", userId)
                .query(JdbcMembershipRepository::mapRow)
                .list();
    }

    @Override
    public void insert(Membership membership) {
        try {
            jdbc.sql("""
                    INSERT INTO organization_members (org_id, user_id, role, added_by, added_at, updated_at)
                    VALUES (:orgId, :userId, :role, :addedBy, :addedAt, :updatedAt)
                    """)
                    .param("orgId", membership.organizationId())
                    .param("userId", membership.userId())
                    .param("role", membership.role())
                    .param("addedBy", membership.addedBy())
                    .param("addedAt", toTimestamp(membership.addedAt()))
                    .param("updatedAt", toTimestamp(membership.updatedAt()))
                    .update();
        } catch (DuplicateKeyException e) {
            throw new DuplicateMemberException(membership.organizationId());
        }
    }

    @Override
    public int updateRole(String orgId, String userId, String role, Instant at) {
        return jdbc.sql("""
                UPDATE organization_members SET role = :role, updated_at = :at
                 WHERE org_id = :orgId AND user_id = :userId
                """)
                .param("role", role)
                .param("at", toTimestamp(at))
                .param("orgId", orgId)
                .param("userId", userId)
                .update();
    }

    @Override
    public int delete(String orgId, String userId) {
        return jdbc.sql("DELETE FROM organization_members WHERE org_id = :orgId AND user_id = :userId")
                .param("orgId", orgId)
                .param("userId", userId)
                .update();
    }

    private static Membership mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Membership(
                rs.getString("org_id"),
                rs.getString("user_id"),
                rs.getString("role"),
                rs.getString("added_by"),
                instant(rs, "added_at"),
                instant(rs, "updated_at"));
    }
}
