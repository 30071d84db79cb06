package com.linkdeck.linkservice.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkdeck.linkservice.domain.user.AccessStatus;
import com.linkdeck.linkservice.domain.user.AppRole;
import com.linkdeck.linkservice.domain.user.UserAccount;
import com.linkdeck.linkservice.domain.user.UserFilter;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.VerifiedIdentity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.ActiveProfiles;

@JdbcTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("JdbcUserStore")
class JdbcUserStoreTest {

    private static final Instant FIRST_LOGIN = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant SECOND_LOGIN = Instant.parse("2025-03-02T08:30:00Z");

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private JdbcClient jdbc;

    @BeforeEach
    void setUp() {
        jdbc = JdbcClient.create(jdbcTemplate);
    }

    @Test
    @DisplayName("creates a user on first sight with a lowercase email")
    void createsUser() {
        LocalUser user = store(FIRST_LOGIN).upsertFromIdentity(
                new VerifiedIdentity("u-1", "Jane@Example.COM", "Jane", "user"));

        assertThat(user.email()).isEqualTo("jane@example.com");
        assertThat(user.superAdmin()).isFalse();
        assertThat(user.createdAt()).isEqualTo(FIRST_LOGIN);
        assertThat(user.lastLoginAt()).isEqualTo(FIRST_LOGIN);
    }

    @Test
    @DisplayName("refreshes profile fields and keeps createdAt and the super-admin flag")
    void refreshesUser() {
        store(FIRST_LOGIN).upsertFromIdentity(new VerifiedIdentity("u-1", "jane@example.com", "Jane", "user"));
        jdbc.sql("UPDATE users SET super_admin = TRUE WHERE external_id = 'u-1'").update();

        LocalUser user = store(SECOND_LOGIN).upsertFromIdentity(
                new VerifiedIdentity("u-1", "jane.doe@example.com", "Jane Doe", "admin"));

        assertThat(user.name()).isEqualTo("Jane Doe");
        assertThat(user.email()).isEqualTo("jane.doe@example.com");
        assertThat(user.isAdmin()).isTrue();
        assertThat(user.superAdmin()).isTrue();
        assertThat(user.createdAt()).isEqualTo(FIRST_LOGIN);
        assertThat(user.lastLoginAt()).isEqualTo(SECOND_LOGIN);
    }

    @Test
    @DisplayName("finds users by email case-insensitively and by id batch")
    void lookups() {
        JdbcUserStore store = store(FIRST_LOGIN);
        store.upsertFromIdentity(new VerifiedIdentity("u-1", "jane@example.com", "Jane", "user"));
        store.upsertFromIdentity(new VerifiedIdentity("u-2", "john@example.com", "John", "user"));

        assertThat(store.findByEmail(" JANE@example.com ")).map(LocalUser::externalId).contains("u-1");
        assertThat(store.findByEmail("nobody@example.com")).isEmpty();
        assertThat(store.findByIds(List.of("u-1", "u-2", "u-3")))
                .extracting(LocalUser::externalId)
                .containsExactlyInAnyOrder("u-1", "u-2");
        assertThat(store.findByIds(List.of())).isEmpty();
    }

    private JdbcUserStore store(Instant now) {
        return new JdbcUserStore(jdbc, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("new users start pending without access and logins do not reset granted access")
    void accessSurvivesLogin() {
        JdbcUserStore store = store(FIRST_LOGIN);
        store.upsertFromIdentity(new VerifiedIdentity("u-1", "jane@example.com", "Jane", "user"));

        assertThat(store.listAccounts(UserFilter.ALL)).singleElement().satisfies(account -> {
            assertThat(account.appRole()).isEqualTo(AppRole.NONE);
            assertThat(account.appStatus()).isEqualTo(AccessStatus.PENDING);
            assertThat(account.hasAccess()).isFalse();
        });

        assertThat(store.updateAccess("u-1", AppRole.ADMIN, AccessStatus.ACTIVE, true, SECOND_LOGIN)).isTrue();
        store(SECOND_LOGIN).upsertFromIdentity(new VerifiedIdentity("u-1", "jane@example.com", "Jane", "user"));

        UserAccount account = store.listAccounts(UserFilter.ACTIVE).get(0);
        assertThat(account.appRole()).isEqualTo(AppRole.ADMIN);
        assertThat(account.hasAccess()).isTrue();
        assertThat(account.updatedAt()).isEqualTo(SECOND_LOGIN);
    }

    @Test
    @DisplayName("lists accounts newest first and filters by status")
    void listsAccounts() {
        store(FIRST_LOGIN).upsertFromIdentity(new VerifiedIdentity("u-old", "old@example.com", "Old", "user"));
        store(SECOND_LOGIN).upsertFromIdentity(new VerifiedIdentity("u-new", "new@example.com", "New", "user"));
        JdbcUserStore store = store(SECOND_LOGIN);
        store.updateAccess("u-old", AppRole.USER, AccessStatus.ACTIVE, true, SECOND_LOGIN);

        assertThat(store.listAccounts(UserFilter.ALL)).extracting(UserAccount::userId).containsExactly("u-new", "u-old");
        assertThat(store.listAccounts(UserFilter.PENDING)).extracting(UserAccount::userId).containsExactly("u-new");
        assertThat(store.listAccounts(UserFilter.ACTIVE)).extracting(UserAccount::userId).containsExactly("u-old");
    }

    @Test
    @DisplayName("changes only the application role and reports unknown users")
    void changesAppRole() {
        JdbcUserStore store = store(FIRST_LOGIN);
        store.upsertFromIdentity(new VerifiedIdentity("u-1", "jane@example.com", "Jane", "user"));

        assertThat(store.updateAppRole("u-1", AppRole.USER, SECOND_LOGIN)).isTrue();
        assertThat(store.updateAppRole("ghost", AppRole.USER, SECOND_LOGIN)).isFalse();
        assertThat(store.updateAccess("ghost", AppRole.NONE, AccessStatus.REVOKED, false, SECOND_LOGIN)).isFalse();

        UserAccount account = store.listAccounts(UserFilter.ALL).get(0);
        assertThat(account.appRole()).isEqualTo(AppRole.USER);
        assertThat(account.appStatus()).isEqualTo(AccessStatus.PENDING);
    }
}
