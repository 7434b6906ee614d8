package io.podcontroller.lock;

import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local Locker. Acquisition never waits: a held lock fails immediately.
 */
@Slf4j
public class InMemoryLocker implements Locker {

    private final Map<String, HeldLock> held = new ConcurrentHashMap<>();
    private final Map<String, List<Runnable>> lostListeners = new ConcurrentHashMap<>();
    private final AtomicLong nextLease = new AtomicLong(1);

    @Override
    public HeldLock lock(String lockPath) throws LockException {
        HeldLock candidate = new HeldLock(lockPath, nextLease.getAndIncrement(), lockPath, null);
        if (held.putIfAbsent(lockPath, candidate) != null) {
            throw new LockException("Lock " + lockPath + " is already held");
        }
        log.debug("Lock acquired: {}", lockPath);
        return candidate;
    }

    @Override
    public void unlock(HeldLock lock) {
        if (lock == null) {
            return;
        }
        if (held.remove(lock.getLockPath(), lock)) {
            lostListeners.remove(lock.getLockPath());
            log.debug("Lock released: {}", lock.getLockPath());
        }
    }

    @Override
    public WatchHandle watchLock(HeldLock lock, Runnable onLockLost) {
        List<Runnable> listeners = lostListeners.computeIfAbsent(lock.getLockPath(), ignored -> new CopyOnWriteArrayList<>());
        listeners.add(onLockLost);
        return () -> listeners.remove(onLockLost);
    }

    public boolean isLocked(String lockPath) {
        return held.containsKey(lockPath);
    }

    /**
     * Drop a lock as if its lease had expired, notifying its watchers.
     */
    public void expire(String lockPath) {
        if (held.remove(lockPath) != null) {
            List<Runnable> listeners = lostListeners.remove(lockPath);
            if (listeners != null) {
                listeners.forEach(Runnable::run);
            }
        }
    }
}
