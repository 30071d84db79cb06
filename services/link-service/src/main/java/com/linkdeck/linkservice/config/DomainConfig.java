package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.domain.membership.MembershipRepository;
import com.linkdeck.linkservice.domain.membership.MembershipService;
import com.linkdeck.linkservice.domain.organization.OrganizationService;
import com.linkdeck.linkservice.domain.organization.OrganizationStore;
import com.linkdeck.linkservice.domain.role.CustomRoleRepository;
import com.linkdeck.linkservice.domain.role.CustomRoleService;
import com.linkdeck.linkservice.domain.user.UserAccessService;
import com.linkdeck.linkservice.domain.user.UserStore;
import com.linkdeck.security.LastAdminGuard;
import com.linkdeck.security.OrganizationLocks;
import com.linkdeck.security.RoleResolver;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration(proxyBeanMethods = false)
public class DomainConfig {

    @Bean
    MembershipService membershipService(MembershipRepository members, UserStore users, RoleResolver roles,
                                        LastAdminGuard guard, OrganizationLocks locks,
                                        TransactionTemplate tx, Clock clock) {
        return new MembershipService(members, users, roles, guard, locks, tx, clock);
    }

    @Bean
    OrganizationService organizationService(OrganizationStore organizations, MembershipRepository members,
                                            TransactionTemplate tx, Clock clock) {
        return new OrganizationService(organizations, members, tx, clock);
    }

    @Bean
    CustomRoleService customRoleService(CustomRoleRepository roles, MembershipRepository members,
                                        RoleResolver resolver, Clock clock) {
        return new CustomRoleService(roles, members, resolver, clock);
    }

    @Bean
    UserAccessService userAccessService(UserStore users, Clock clock) {
        return new UserAccessService(users, clock);
    }
}
