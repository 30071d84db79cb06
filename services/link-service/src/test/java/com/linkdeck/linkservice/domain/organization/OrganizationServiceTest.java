package com.linkdeck.linkservice.domain.organization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.linkdeck.linkservice.domain.membership.InMemoryMembershipRepository;
import com.linkdeck.security.DomainException;
import com.linkdeck.security.ErrorCode;
import com.linkdeck.security.LocalUser;
import com.linkdeck.security.testing.TestUsers;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrganizationService")
class OrganizationServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final LocalUser ALICE = TestUsers.user("alice");

    @Mock
    private OrganizationStore organizations;

    private InMemoryMembershipRepository members;
    private OrganizationService service;

    @BeforeEach
    void setUp() {
        members = new InMemoryMembershipRepository();
        service = new OrganizationService(organizations, members,
                TransactionOperations.withoutTransaction(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("creates an active organization with the creator as admin")
        void createsWithAdmin() {
            Organization created = service.create(new CreateOrganizationCommand("Acme Corp", "Acme-Corp", "Anvils"), ALICE);

            assertThat(created.slug()).isEqualTo("acme-corp");
            assertThat(created.active()).isTrue();
            assertThat(created.createdAt()).isEqualTo(NOW);
            verify(organizations).insert(created);
            assertThat(members.findRole(created.id(), "alice")).contains("admin");
            assertThat(members.find(created.id(), "alice").orElseThrow().addedBy()).isEqualTo("alice");
        }

        @Test
        @DisplayName("requires a name")
        void nameRequired() {
            assertThatThrownBy(() -> service.create(new CreateOrganizationCommand("  ", "acme", null), ALICE))
                    .isInstanceOf(DomainException.class)
                    .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "acme corp", "acme_corp", "ácme"})
        @DisplayName("rejects malformed slugs")
        void malformedSlug(String slug) {
            assertThatThrownBy(() -> service.create(new CreateOrganizationCommand("Acme", slug, null), ALICE))
                    .isInstanceOf(DomainException.class)
                    .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
            verify(organizations, never()).insert(any());
        }

        @Test
        @DisplayName("rejects a slug that is already taken")
        void slugTaken() {
            when(organizations.slugExists("acme")).thenReturn(true);

            assertThatThrownBy(() -> service.create(new CreateOrganizationCommand("Acme", "acme", null), ALICE))
                    .isInstanceOf(DomainException.class)
                    .extracting("code").isEqualTo(ErrorCode.SLUG_CONFLICT);
        }

        @Test
        @DisplayName("maps a slug race lost at insert time to SLUG_CONFLICT")
        void slugRace() {
            doThrow(new DuplicateKeyException("organizations_slug_key")).when(organizations).insert(any());

            assertThatThrownBy(() -> service.create(new CreateOrganizationCommand("Acme", "acme", null), ALICE))
                    .isInstanceOf(DomainException.class)
                    .extracting("code").isEqualTo(ErrorCode.SLUG_CONFLICT);
        }
    }

    @Nested
    @DisplayName("listForUser()")
    class ListForUser {

        private final Organization acme = new Organization("org-acme", "acme", "Acme", null, true, NOW, NOW);
        private final Organization globex = new Organization("org-globex", "globex", "Globex", null, true, NOW, NOW);

        @Test
        @DisplayName("lists the user's organizations with their role")
        @SuppressWarnings("unchecked")
        void memberSeesOwn() {
            members.put("org-acme", "alice", "editor");
            when(organizations.findActiveByIds(anyCollection())).thenReturn(List.of(acme));

            List<OrganizationMembership> listed = service.listForUser(ALICE);

            assertThat(listed).containsExactly(new OrganizationMembership(acme, "editor"));
            ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
            verify(organizations).findActiveByIds(ids.capture());
            assertThat(ids.getValue()).containsExactly("org-acme");
        }

        @Test
        @DisplayName("super-admins see every active organization")
        void superAdminSeesAll() {
            members.put("org-acme", "root", "admin");
            when(organizations.findActive()).thenReturn(List.of(acme, globex));

            List<OrganizationMembership> listed = service.listForUser(TestUsers.superAdmin("root"));

            assertThat(listed).containsExactly(
                    new OrganizationMembership(acme, "admin"),
                    new OrganizationMembership(globex, null));
            verify(organizations, never()).findActiveByIds(anyCollection());
        }
    }
}
