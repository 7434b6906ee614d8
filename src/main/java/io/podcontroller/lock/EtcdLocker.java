package io.podcontroller.lock;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Lock;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.lock.LockResponse;
import io.etcd.jetcd.support.CloseableClient;
import io.etcd.jetcd.support.Observers;
import io.etcd.jetcd.watch.WatchEvent;
import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.podcontroller.config.Constants.ETCD_OPERATION_TIMEOUT_SECONDS;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Locker on top of the etcd lock service. Each lock owns a lease that is kept alive while
 * held, so a crashed holder loses its locks once the lease TTL runs out.
 */
@Slf4j
public class EtcdLocker implements Locker {

    private final Lock lockClient;
    private final Lease leaseClient;
    private final Watch watchClient;
    private final int ttlSeconds;

    public EtcdLocker(Client etcdClient, int ttlSeconds) {
        this.lockClient = etcdClient.getLockClient();
        this.leaseClient = etcdClient.getLeaseClient();
        this.watchClient = etcdClient.getWatchClient();
        this.ttlSeconds = ttlSeconds;

        log.info("EtcdLocker initialized (lease ttl: {}s)", ttlSeconds);
    }

    @Override
    public HeldLock lock(String lockPath) throws LockException {
        long leaseId = 0;
        CloseableClient keepAlive = null;
        try {
            log.debug("Attempting to acquire lock {}", lockPath);

            leaseId = leaseClient.grant(ttlSeconds)
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .getID();

            // Keep-alive must run before lock() blocks, or the lease can expire while waiting
            keepAlive = leaseClient.keepAlive(leaseId, Observers.observer(response -> {
            }));

            LockResponse lockResponse = lockClient.lock(ByteSequence.from(lockPath, UTF_8), leaseId)
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            String lockKey = lockResponse.getKey().toString(UTF_8);

            log.info("Lock acquired: {} (leaseId: {}, lockKey: {})", lockPath, leaseId, lockKey);
            return new HeldLock(lockPath, leaseId, lockKey, keepAlive);

        } catch (TimeoutException e) {
            log.debug("Timeout acquiring lock {}", lockPath);
            abandonLease(leaseId, keepAlive);
            throw new LockException("Timeout acquiring lock " + lockPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonLease(leaseId, keepAlive);
            throw new LockException("Interrupted acquiring lock " + lockPath, e);
        } catch (Exception e) {
            log.warn("Failed to acquire lock {}", lockPath, e);
            abandonLease(leaseId, keepAlive);
            throw new LockException("Failed to acquire lock " + lockPath, e);
        }
    }

    @Override
    public void unlock(HeldLock lock) {
        if (lock == null) {
            return;
        }
        try {
            log.debug("Releasing lock {}", lock.getLockPath());
            if (lock.getKeepAliveObserver() != null) {
                lock.getKeepAliveObserver().close();
            }
            // Revoking the lease deletes the lock key
            leaseClient.revoke(lock.getLeaseId()).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Lock released: {}", lock.getLockPath());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted releasing lock {}", lock.getLockPath(), e);
        } catch (Exception e) {
            log.error("Error releasing lock {}", lock.getLockPath(), e);
        }
    }

    @Override
    public WatchHandle watchLock(HeldLock lock, Runnable onLockLost) {
        Watch.Watcher watcher = watchClient.watch(ByteSequence.from(lock.getLockKey(), UTF_8), watchResponse -> {
            for (WatchEvent event : watchResponse.getEvents()) {
                if (event.getEventType() == WatchEvent.EventType.DELETE
                        || event.getEventType() == WatchEvent.EventType.PUT) {
                    log.warn("Lock lost: {} (event: {})", lock.getLockPath(), event.getEventType());
                    onLockLost.run();
                    break;
                }
            }
        });
        return watcher::close;
    }

    private void abandonLease(long leaseId, CloseableClient keepAlive) {
        if (keepAlive != null) {
            keepAlive.close();
        }
        if (leaseId != 0) {
            leaseClient.revoke(leaseId);
        }
    }
}
