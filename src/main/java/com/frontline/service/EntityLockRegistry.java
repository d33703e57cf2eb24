package com.frontline.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-entity mutual exclusion. Each key ("push:&lt;id&gt;", "war:&lt;id&gt;", ...) gets its own
 * {@link ReentrantLock}; unrelated keys never contend.
 * <p>
 * Acquisition order when nesting, outermost first:
 * {@code player -> pair -> war -> push -> country}. Ledger locks are never held together
 * with any other lock.
 * <p>
 * Entries are reference counted so a lock is dropped from the map only when no thread
 * holds or waits for it.
 */
@Component
public class EntityLockRegistry {

    public static final String LEDGER = "ledger:";
    public static final String PLAYER = "player:";
    public static final String PAIR = "pair:";
    public static final String WAR = "war:";
    public static final String PUSH = "push:";
    public static final String COUNTRY = "country:";
    /** Guards username uniqueness at registration; never nested. */
    public static final String USERNAME = "username:";

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = acquire(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(key);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String key) {
        LockEntry entry = locks.get(key);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    /**
     * Number of keys currently held or awaited.
     */
    public int size() {
        return locks.size();
    }

    private LockEntry acquire(String key) {
        return locks.compute(key, (k, existing) -> {
            LockEntry entry = existing != null ? existing : new LockEntry();
            entry.users++;
            return entry;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
