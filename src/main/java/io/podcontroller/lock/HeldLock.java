package io.podcontroller.lock;

import io.etcd.jetcd.support.CloseableClient;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An acquired lock, with the lease and keep-alive backing it when held in etcd.
 */
@Data
@AllArgsConstructor
public class HeldLock {
    private final String lockPath;
    private final long leaseId;
    private final String lockKey;
    private final CloseableClient keepAliveObserver;
}
