package win.ixuni.stratum.core.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key lock manager
 * <p>
 * Serializes work sharing a key while letting different keys proceed in parallel.
 * Lock entries are reference counted and removed once nobody holds or waits for them.
 */
@Slf4j
public class KeyLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    private static class LockEntry {
        final ReentrantLock lock = new ReentrantLock();
        final AtomicInteger refCount = new AtomicInteger(0);
    }

    /**
     * Run an action while holding the lock for a key
     *
     * @param key    lock key
     * @param action action to run
     * @return action result
     */
    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.refCount.incrementAndGet();
            return e;
        });

        entry.lock.lock();
        log.trace("[KEY_LOCK] Acquired lock for key={}", key);
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            // Remove the entry atomically with the last release
            locks.computeIfPresent(key, (k, e) -> e.refCount.decrementAndGet() == 0 ? null : e);
        }
    }

    /**
     * Get the count of currently active locks (for monitoring)
     */
    public int getActiveLockCount() {
        return locks.size();
    }
}
