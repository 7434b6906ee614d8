package io.podcontroller.rc;

import io.podcontroller.lock.HeldLock;
import io.podcontroller.store.WatchHandle;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A controller the farm runs, with the lock that entitles it to run.
 */
@Getter
@AllArgsConstructor
class ManagedController {
    private final String rcId;
    private final ReplicationController controller;
    private final DesireWatch watch;
    private final HeldLock lock;
    private final WatchHandle lockWatcher;
}
