package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.infrastructure.cache.RoleCacheSweeper;
import com.linkdeck.security.RoleCache;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/** Sweeps the role cache every {@code linkdeck.authorization.cache-sweep-interval}. */
@Configuration(proxyBeanMethods = false)
public class CacheSweepConfig implements SchedulingConfigurer {

    private final RoleCache roleCache;
    private final AuthorizationProperties properties;

    public CacheSweepConfig(RoleCache roleCache, AuthorizationProperties properties) {
        this.roleCache = roleCache;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(new RoleCacheSweeper(roleCache), properties.cacheSweepInterval());
    }
}
