package com.linkdeck.linkservice.infrastructure.cache;

import com.linkdeck.security.RoleCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evicts expired custom roles on a fixed delay, independent of lookups. Scheduled by
 * {@code CacheSweepConfig}.
 */
public class RoleCacheSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RoleCacheSweeper.class);

    private final RoleCache cache;

    public RoleCacheSweeper(RoleCache cache) {
        this.cache = cache;
    }

    @Override
    public void run() {
        try {
            long evicted = cache.sweep();
            if (evicted > 0) {
                log.debug("Role cache sweep evicted {} entries, {} remain", evicted, cache.size());
            }
        } catch (RuntimeException e) {
            log.warn("Role cache sweep failed", e);
        }
    }
}
