package io.podcontroller.lock;

import io.podcontroller.store.WatchHandle;

/**
 * Advisory, exclusive locks on lock paths.
 */
public interface Locker {

    /**
     * Acquire the lock at {@code lockPath}, waiting at most the store operation timeout.
     *
     * @throws LockException if the lock is held elsewhere past the timeout or the store fails
     */
    HeldLock lock(String lockPath) throws LockException;

    /**
     * Release a lock. Never throws; a lock that cannot be released expires with its lease.
     */
    void unlock(HeldLock lock);

    /**
     * Invoke {@code onLockLost} if the lock disappears while still held.
     */
    WatchHandle watchLock(HeldLock lock, Runnable onLockLost);
}
