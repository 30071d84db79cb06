package com.linkdeck.linkservice.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.linkdeck.security.CaffeineRoleCache;
import com.linkdeck.security.PermissionSet;
import com.linkdeck.security.RoleCache;
import com.linkdeck.security.RoleKey;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RoleCacheSweeper")
class RoleCacheSweeperTest {

    @Test
    @DisplayName("evicts expired roles without a lookup")
    void evictsExpired() {
        AtomicLong nanos = new AtomicLong();
        CaffeineRoleCache cache = new CaffeineRoleCache(Duration.ofMinutes(5), 100, nanos::get);
        cache.put(new RoleKey("org-acme", "editor"), PermissionSet.of("cards.read"));
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(6));
        cache.put(new RoleKey("org-acme", "viewer"), PermissionSet.of("cards.read"));

        new RoleCacheSweeper(cache).run();

        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("keeps running when a sweep fails")
    void failureIsContained() {
        RoleCache cache = mock(RoleCache.class);
        when(cache.sweep()).thenThrow(new IllegalStateException("cache closed"));

        assertThatCode(() -> new RoleCacheSweeper(cache).run()).doesNotThrowAnyException();
    }
}
