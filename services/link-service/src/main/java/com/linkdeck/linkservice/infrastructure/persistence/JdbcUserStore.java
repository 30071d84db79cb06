package com.linkdeck.linkservice.infrastructure.persistence;

import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.instant;
import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.toTimestamp;

import com.linkdeck.linkservice.domain.user.AccessStatus;
import com.linkdeck.linkservice.domain.user.AppRole;
import com.linkdeck.linkservice.domain.user.UserAccount;
import com.linkdeck.linkservice.domain.user.UserFilter;
import com.linkdeck.linkservice.domain.user.UserStore;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.VerifiedIdentity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link UserStore} over the {@code users} table.
 *
 * <p>The upsert updates first and inserts only when no row exists. Two first logins racing each
 * other end with one insert and one update.
 */
public class JdbcUserStore implements UserStore {

    private static final String COLUMNS =
            "external_id, email, name, identity_role, super_admin, created_at, last_login_at, updated_at";

    private static final String ACCOUNT_COLUMNS =
            "external_id, email, name, identity_role, app_role, app_status, has_access, "
                    + "created_at, last_login_at, updated_at";

    private final JdbcClient jdbc;
    private final Clock clock;

    public JdbcUserStore(JdbcClient jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public LocalUser upsertFromIdentity(VerifiedIdentity identity) {
        Instant now = clock.instant();
        String email = identity.email() == null ? null : identity.email().trim().toLowerCase(Locale.ROOT);

        if (refresh(identity, email, now) == 0) {
            try {
                jdbc.sql("""
                        INSERT INTO users (external_id, email, name, identity_role, super_admin,
                                           created_at, last_login_at, updated_at)
                        VALUES (:id, :email, :name, :role, FALSE, :now, :now, :now)
                        """)
                        .param("id", identity.id())
                        .param("email", email)
                        .param("name", identity.name())
                        .param("role", identity.role())
                        .param("now", toTimestamp(now))
                        .update();
            } catch (DuplicateKeyException e) {
                refresh(identity, email, now);
            }
        }
        return findById(identity.id())
                .orElseThrow(() -> new IllegalStateException("user vanished after upsert"));
    }

    private int refresh(VerifiedIdentity identity, String email, Instant now) {
        return jdbc.sql("""
                UPDATE users
                   SET email = :email, name = :name, identity_role = :role,
                       last_login_at = :now, updated_at = :now
                 WHERE external_id = :id
                """)
                .param("id", identity.id())
                .param("email", email)
                .param("name", identity.name())
                .param("role", identity.role())
                .param("now", toTimestamp(now))
                .update();
    }

    @Override
    public Optional<LocalUser> findById(String externalId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM users WHERE external_id = :id")
                .param("id", externalId)
                .query(JdbcUserStore::mapRow)
                .optional();
    }

    @Override
    public Optional<LocalUser> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return jdbc.sql("SELECT " + COLUMNS + " FROM users WHERE email = :email")
                .param("email", email.trim().toLowerCase(Locale.ROOT))
                .query(JdbcUserStore::mapRow)
                .optional();
    }

    @Override
    public List<LocalUser> findByIds(Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return List.of();
        }
        return jdbc.sql("SELECT " + COLUMNS + " FROM users WHERE external_id IN (:ids)")
                .param("ids", List.copyOf(externalIds))
                .query(JdbcUserStore::mapRow)
                .list();
    }

    @Override
    public List<UserAccount> listAccounts(UserFilter filter) {
        String where = switch (filter) {
            case ALL -> "";
            case PENDING -> " WHERE app_status = 'pending'";
            case ACTIVE -> " WHERE app_status = 'active'";
        };
        return jdbc.sql("SELECT " + ACCOUNT_COLUMNS + " FROM users" + where + " ORDER BY created_at DESC")
                .query(JdbcUserStore::mapAccount)
                .list();
    }

    @Override
    public boolean updateAccess(String externalId, AppRole role, AccessStatus status, boolean hasAccess,
                                Instant at) {
        return jdbc.sql("""
                UPDATE users
                   SET app_role = :role, app_status = :status, has_access = :access, updated_at = :at
                 WHERE external_id = :id
                """)
                .param("id", externalId)
                .param("role", role.id())
                .param("status", status.id())
                .param("access", hasAccess)
                .param("at", toTimestamp(at))
                .update() > 0;
    }

    @Override
    public boolean updateAppRole(String externalId, AppRole role, Instant at) {
        return jdbc.sql("UPDATE users SET app_role = :role, updated_at = :at WHERE external_id = :id")
                .param("id", externalId)
                .param("role", role.id())
                .param("at", toTimestamp(at))
                .update() > 0;
    }

    private static UserAccount mapAccount(ResultSet rs, int rowNum) throws SQLException {
        return new UserAccount(
                rs.getString("external_id"),
                rs.getString("email"),
                rs.getString("name"),
                rs.getString("identity_role"),
                AppRole.fromId(rs.getString("app_role")),
                AccessStatus.fromId(rs.getString("app_status")),
                rs.getBoolean("has_access"),
                instant(rs, "created_at"),
                instant(rs, "last_login_at"),
                instant(rs, "updated_at"));
    }

    private static LocalUser mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new LocalUser(
                rs.getString("external_id"),
                rs.getString("email"),
                rs.getString("name"),
                rs.getString("identity_role"),
                rs.getBoolean("super_admin"),
                instant(rs, "created_at"),
                instant(rs, "last_login_at"),
                instant(rs, "updated_at"));
    }
}
