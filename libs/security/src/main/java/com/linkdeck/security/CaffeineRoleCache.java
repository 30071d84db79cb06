package com.linkdeck.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory {@link RoleCache} backed by Caffeine with expire-after-write.
 * <p>
 * Reads never see an expired entry. Expired entries still occupy memory until a
 * {@link #sweep()} or Caffeine's own maintenance removes them; the service schedules sweeps
 * at a fixed interval independent of lookups. Maintenance runs on the calling thread.
 */
public class CaffeineRoleCache implements RoleCache {

    /** Default entry lifetime. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Cache<RoleKey, PermissionSet> cache;
    private final Duration ttl;

    public CaffeineRoleCache(Duration ttl, long maximumSize) {
        this(ttl, maximumSize, Ticker.systemTicker());
    }

    /**
     * @param ttl         entry lifetime measured from the last write
     * @param maximumSize upper bound on live entries
     * @param ticker      time source (tests drive it manually)
     */
    public CaffeineRoleCache(Duration ttl, long maximumSize, Ticker ticker) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<PermissionSet> get(RoleKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(RoleKey key, PermissionSet permissions) {
        cache.put(key, permissions);
    }

    @Override
    public void invalidate(RoleKey key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long sweep() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        return Math.max(0, before - cache.estimatedSize());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    public Duration ttl() {
        return ttl;
    }
}
