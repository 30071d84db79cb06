package com.linkdeck.security;

import com.linkdeck.security.testing.InMemoryMembershipStore;
import com.linkdeck.security.testing.InMemoryRoleStore;
import com.linkdeck.security.testing.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionEngine")
class PermissionEngineTest {

    private InMemoryMembershipStore memberships;
    private InMemoryRoleStore roles;
    private List<PermissionCheck> checks;
    private PermissionEngine engine;

    @BeforeEach
    void setUp() {
        memberships = new InMemoryMembershipStore()
                .put("acme", "u1", "admin")
                .put("acme", "u2", "user")
                .put("acme", "u3", "editor")
                .put("acme", "u4", "retired-role");
        roles = new InMemoryRoleStore().define("acme", "editor", Permissions.CARDS_READ, Permissions.CARDS_WRITE);
        checks = new ArrayList<>();
        engine = new PermissionEngine(
                memberships,
                new RoleResolver(roles, new CaffeineRoleCache(Duration.ofMinutes(5), 100)),
                checks::add,
                Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("super-admin bypass")
    class SuperAdmin {

        @ParameterizedTest
        @ValueSource(strings = {"org.delete", "members.write", "anything.at.all"})
        @DisplayName("is granted any permission in any organization without membership")
        void grantedEverywhere(String permission) {
            var root = TestUsers.superAdmin("root");

            assertThat(engine.hasPermission(root, "acme", permission)).isTrue();
            assertThat(engine.hasPermission(root, "unknown-org", permission)).isTrue();
            assertThat(memberships.roleReads()).isZero();
        }

        @Test
        @DisplayName("is granted even when the membership store is down")
        void grantedWhenStoreFails() {
            memberships.failReads(true);

            assertThat(engine.hasPermission(TestUsers.superAdmin("root"), "acme", Permissions.ORG_DELETE)).isTrue();
        }
    }

    @Nested
    @DisplayName("missing inputs")
    class MissingInputs {

        @Test
        @DisplayName("deny a null user, organization or permission")
        void denyMissing() {
            assertThat(engine.hasPermission(null, "acme", Permissions.CARDS_READ)).isFalse();
            assertThat(engine.hasPermission(TestUsers.user("u1"), null, Permissions.CARDS_READ)).isFalse();
            assertThat(engine.hasPermission(TestUsers.user("u1"), "acme", " ")).isFalse();
            assertThat(memberships.roleReads()).isZero();
        }
    }

    @Nested
    @DisplayName("system roles")
    class SystemRoles {

        @Test
        @DisplayName("user role may write cards")
        void userWritesCards() {
            assertThat(engine.hasPermission(TestUsers.user("u2"), "acme", "cards.write")).isTrue();
        }

        @Test
        @DisplayName("user role may not delete the organization")
        void userCannotDeleteOrg() {
            assertThat(engine.hasPermission(TestUsers.user("u2"), "acme", "org.delete")).isFalse();
        }

        @Test
        @DisplayName("admin role may manage members")
        void adminManagesMembers() {
            assertThat(engine.hasPermission(TestUsers.user("u1"), "acme", Permissions.MEMBERS_WRITE)).isTrue();
        }
    }

    @Nested
    @DisplayName("non-members")
    class NonMembers {

        @ParameterizedTest
        @ValueSource(strings = {"org.read", "cards.read", "members.read", "made.up"})
        @DisplayName("are denied every permission")
        void deniedEverything(String permission) {
            assertThat(engine.hasPermission(TestUsers.user("stranger"), "acme", permission)).isFalse();
        }

        @Test
        @DisplayName("are denied when the membership store fails")
        void deniedOnStoreFailure() {
            memberships.failReads(true);

            assertThat(engine.hasPermission(TestUsers.user("u1"), "acme", Permissions.CARDS_READ)).isFalse();
        }
    }

    @Nested
    @DisplayName("custom roles")
    class CustomRoles {

        @Test
        @DisplayName("grant only their stored permissions")
        void storedPermissions() {
            var editor = TestUsers.user("u3");

            assertThat(engine.hasPermission(editor, "acme", Permissions.CARDS_WRITE)).isTrue();
            assertThat(engine.hasPermission(editor, "acme", Permissions.CARDS_DELETE)).isFalse();
        }

        @Test
        @DisplayName("an unknown role is denied rather than raising an error")
        void unknownRoleDenied() {
            assertThat(engine.hasPermission(TestUsers.user("u4"), "acme", Permissions.CARDS_READ)).isFalse();
        }
    }

    @Nested
    @DisplayName("per-request memo")
    class Memo {

        @Test
        @DisplayName("reads membership once for several checks in one request")
        void oneReadPerRequest() {
            var scope = new RequestScope();
            var user = TestUsers.user("u2");

            engine.hasPermission(user, "acme", Permissions.CARDS_READ, scope);
            engine.hasPermission(user, "acme", Permissions.CARDS_WRITE, scope);
            engine.hasPermission(user, "acme", Permissions.ORG_DELETE, scope);

            assertThat(memberships.roleReads()).isEqualTo(1);
        }

        @Test
        @DisplayName("memoizes non-membership too")
        void memoizesNonMembership() {
            var scope = new RequestScope();
            var stranger = TestUsers.user("stranger");

            engine.hasPermission(stranger, "acme", Permissions.CARDS_READ, scope);
            engine.hasPermission(stranger, "acme", Permissions.CARDS_WRITE, scope);

            assertThat(memberships.roleReads()).isEqualTo(1);
        }

        @Test
        @DisplayName("separate requests do not share the memo")
        void separateRequests() {
            var user = TestUsers.user("u2");

            engine.hasPermission(user, "acme", Permissions.CARDS_READ, new RequestScope());
            engine.hasPermission(user, "acme", Permissions.CARDS_READ, new RequestScope());

            assertThat(memberships.roleReads()).isEqualTo(2);
        }

        @Test
        @DisplayName("resolveRole reuses the memo filled by a permission check")
        void resolveRoleUsesMemo() {
            var scope = new RequestScope();
            var user = TestUsers.user("u1");

            engine.hasPermission(user, "acme", Permissions.MEMBERS_READ, scope);

            assertThat(engine.resolveRole(user, "acme", scope)).contains("admin");
            assertThat(memberships.roleReads()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("telemetry")
    class Telemetry {

        @Test
        @DisplayName("records one sample per evaluation with memo hits")
        void recordsSamples() {
            var scope = new RequestScope();
            var user = TestUsers.user("u2");

            engine.hasPermission(user, "acme", Permissions.CARDS_READ, scope);
            engine.hasPermission(user, "acme", Permissions.ORG_DELETE, scope);

            assertThat(checks).hasSize(2);
            assertThat(checks.get(0).granted()).isTrue();
            assertThat(checks.get(0).memoHit()).isFalse();
            assertThat(checks.get(1).granted()).isFalse();
            assertThat(checks.get(1).memoHit()).isTrue();
            assertThat(checks).noneMatch(PermissionCheck::slow);
        }

        @Test
        @DisplayName("a failing listener never changes the decision")
        void failingListener() {
            var noisy = new PermissionEngine(
                    memberships,
                    new RoleResolver(roles, new CaffeineRoleCache(Duration.ofMinutes(5), 100)),
                    check -> {
                        throw new IllegalStateException("metrics backend down");
                    },
                    Duration.ofMillis(100));

            assertThat(noisy.hasPermission(TestUsers.user("u2"), "acme", Permissions.CARDS_WRITE)).isTrue();
        }

        @Test
        @DisplayName("flags checks slower than the threshold")
        void flagsSlowChecks() {
            var slowStore = new InMemoryMembershipStore() {
                @Override
                public java.util.Optional<String> findRole(String orgId, String userId) {
                    try {
                        Thread.sleep(20);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return java.util.Optional.of("user");
                }
            };
            List<PermissionCheck> samples = new ArrayList<>();
            var slowEngine = new PermissionEngine(
                    slowStore,
                    new RoleResolver(roles, new CaffeineRoleCache(Duration.ofMinutes(5), 100)),
                    samples::add,
                    Duration.ofMillis(1));

            slowEngine.hasPermission(TestUsers.user("u2"), "acme", Permissions.CARDS_READ);

            assertThat(samples).singleElement().satisfies(sample -> assertThat(sample.slow()).isTrue());
        }
    }
}
