package com.linkdeck.linkservice.infrastructure.persistence;

import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.instant;
import static com.linkdeck.linkservice.infrastructure.persistence.JdbcTimestamps.toTimestamp;

import com.linkdeck.linkservice.domain.audit.AuditEvent;
import com.linkdeck.linkservice.domain.audit.AuditEventStore;
import com.linkdeck.linkservice.domain.audit.AuditStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;

/** Append-only {@link AuditEventStore} over {@code auth_audit_log}. */
public class JdbcAuditEventStore implements AuditEventStore {

    private static final int MAX_MESSAGE = 1000;
    private static final int MAX_USER_AGENT = 512;

    private final JdbcClient jdbc;

    public JdbcAuditEventStore(JdbcClient jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(AuditEvent event) {
        jdbc.sql("""
                INSERT INTO auth_audit_log (user_id, email, status, message, client_ip, user_agent, created_at)
                VALUES (:userId, :email, :status, :message, :clientIp, :userAgent, :createdAt)
                """)
                .param("userId", event.userId())
                .param("email", event.email())
                .param("status", event.status().name())
                .param("message", clip(event.message(), MAX_MESSAGE))
                .param("clientIp", event.clientIp())
                .param("userAgent", clip(event.userAgent(), MAX_USER_AGENT))
                .param("createdAt", toTimestamp(event.createdAt()))
                .update();
    }

    @Override
    public List<AuditEvent> findRecent(int limit) {
        return jdbc.sql("""
                SELECT user_id, email, status, message, client_ip, user_agent, created_at
                  FROM auth_audit_log ORDER BY id DESC LIMIT :limit
                """)
                .param("limit", limit)
                .query(JdbcAuditEventStore::mapRow)
                .list();
    }

    private static AuditEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new AuditEvent(
                rs.getString("user_id"),
                rs.getString("email"),
                AuditStatus.valueOf(rs.getString("status")),
                rs.getString("message"),
                rs.getString("client_ip"),
                rs.getString("user_agent"),
                instant(rs, "created_at"));
    }

    private static String clip(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
