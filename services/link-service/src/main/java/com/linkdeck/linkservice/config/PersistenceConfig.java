package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.infrastructure.persistence.JdbcAuditEventStore;
import com.linkdeck.linkservice.infrastructure.persistence.JdbcCustomRoleRepository;
import com.linkdeck.linkservice.infrastructure.persistence.JdbcMembershipRepository;
import com.linkdeck.linkservice.infrastructure.persistence.JdbcOrganizationStore;
import com.linkdeck.linkservice.infrastructure.persistence.JdbcUserStore;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

/** JDBC stores. The schema is owned by the Flyway scripts under {@code db/migration}. */
@Configuration(proxyBeanMethods = false)
public class PersistenceConfig {

    @Bean
    JdbcUserStore userStore(JdbcClient jdbc, Clock clock) {
        return new JdbcUserStore(jdbc, clock);
    }

    @Bean
    JdbcOrganizationStore organizationStore(JdbcClient jdbc) {
        return new JdbcOrganizationStore(jdbc);
    }

    @Bean
    JdbcMembershipRepository membershipRepository(JdbcClient jdbc) {
        return new JdbcMembershipRepository(jdbc);
    }

    @Bean
    JdbcCustomRoleRepository customRoleRepository(JdbcClient jdbc) {
        return new JdbcCustomRoleRepository(jdbc);
    }

    @Bean
    JdbcAuditEventStore auditEventStore(JdbcClient jdbc) {
        return new JdbcAuditEventStore(jdbc);
    }
}
