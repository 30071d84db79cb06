package com.linkdeck.security;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes membership mutations per organization within this process.
 * <p>
 * Demotions and removals in the same organization run one at a time, so the admin count read
 * by {@link LastAdminGuard} cannot go stale before the write. Different organizations do not
 * contend. Locks are weakly held: a lock nobody holds or waits on may be collected, and the
 * next caller for that organization gets a fresh one.
 */
public class OrganizationLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(orgId -> new ReentrantLock(true));

    /**
     * Runs {@code action} while holding the organization's lock.
     */
    public <T> T withLock(String orgId, Supplier<T> action) {
        ReentrantLock lock = lockFor(orgId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String orgId) {
        return locks.get(orgId);
    }
}
