package com.linkdeck.linkservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authorization tuning, bound from {@code linkdeck.authorization.*}.
 *
 * @param roleCacheTtl lifetime of a cached custom role (default 5m)
 * @param roleCacheMaxSize upper bound on cached custom roles (default 10 000)
 * @param cacheSweepInterval delay between role cache sweeps (default 1m)
 * @param slowCheckThreshold permission checks slower than this are logged (default 100ms)
 * @param orgSlugCacheTtl lifetime of a cached slug lookup (default 60s)
 */
@ConfigurationProperties(prefix = "linkdeck.authorization")
@Validated
public record AuthorizationProperties(
        Duration roleCacheTtl,
        long roleCacheMaxSize,
        Duration cacheSweepInterval,
        Duration slowCheckThreshold,
        Duration orgSlugCacheTtl) {

    public AuthorizationProperties {
        if (roleCacheTtl == null || roleCacheTtl.isZero() || roleCacheTtl.isNegative()) {
            roleCacheTtl = Duration.ofMinutes(5);
        }
        if (roleCacheMaxSize <= 0) {
            roleCacheMaxSize = 10_000;
        }
        if (cacheSweepInterval == null || cacheSweepInterval.isZero() || cacheSweepInterval.isNegative()) {
            cacheSweepInterval = Duration.ofMinutes(1);
        }
        if (slowCheckThreshold == null) {
            slowCheckThreshold = Duration.ofMillis(100);
        }
        if (orgSlugCacheTtl == null || orgSlugCacheTtl.isNegative()) {
            orgSlugCacheTtl = Duration.ofSeconds(60);
        }
    }
}
