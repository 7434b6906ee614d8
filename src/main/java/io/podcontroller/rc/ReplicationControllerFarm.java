package io.podcontroller.rc;

import com.google.common.util.concurrent.AtomicDouble;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Timer;
import io.podcontroller.labels.Applicator;
import io.podcontroller.lock.HeldLock;
import io.podcontroller.lock.LockException;
import io.podcontroller.lock.Locker;
import io.podcontroller.metrics.MetricsProvider;
import io.podcontroller.models.RcRecord;
import io.podcontroller.rc.store.RcStore;
import io.podcontroller.scheduler.Scheduler;
import io.podcontroller.status.WatchStatusTracker;
import io.podcontroller.store.PodPathScheme;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.podcontroller.metrics.MetricsConstants.FARM_SYNC_DURATION_METRIC_NAME;
import static io.podcontroller.metrics.MetricsConstants.MANAGED_RCS_METRIC_NAME;

/**
 * Runs one {@link ReplicationController} per record in the RC store. A record is only
 * run by the process holding its lock, so several farms can share a store. Errors from
 * every loop are drained into the {@link WatchStatusTracker}.
 */
@Slf4j
public class ReplicationControllerFarm {

    private final RcStore rcStore;
    private final Scheduler scheduler;
    private final PodStore podStore;
    private final Applicator applicator;
    private final Locker locker;
    private final WatchStatusTracker statusTracker;
    private final Duration interval;
    private final PodPathScheme paths;
    private final AtomicDouble managedGauge;
    private final Timer syncTimer;
    private final ScheduledExecutorService syncExecutor;

    private final ConcurrentMap<String, ManagedController> controllers = new ConcurrentHashMap<>();
    private WatchHandle recordsWatch;

    public ReplicationControllerFarm(RcStore rcStore, Scheduler scheduler, PodStore podStore, Applicator applicator,
                                     Locker locker, WatchStatusTracker statusTracker, MetricsProvider metricsProvider,
                                     Duration interval) {
        this.rcStore = rcStore;
        this.scheduler = scheduler;
        this.podStore = podStore;
        this.applicator = applicator;
        this.locker = locker;
        this.statusTracker = statusTracker;
        this.interval = interval;
        this.paths = PodPathScheme.getInstance();
        this.managedGauge = metricsProvider.gauge(MANAGED_RCS_METRIC_NAME, Map.of());
        this.syncTimer = metricsProvider.timer(FARM_SYNC_DURATION_METRIC_NAME, Map.of());
        this.syncExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
            .setNameFormat("rc-farm-sync-%d")
            .setDaemon(true)
            .build());

        log.info("ReplicationControllerFarm initialized (sync interval: {}s)", interval.toSeconds());
    }

    /**
     * Start syncing with the RC store: immediately, whenever any record changes, and at the
     * sync interval.
     */
    @PostConstruct
    public synchronized void start() {
        if (recordsWatch != null) {
            log.warn("ReplicationControllerFarm already started");
            return;
        }
        recordsWatch = rcStore.watchAll(this::requestSync);
        syncExecutor.scheduleWithFixedDelay(this::sync, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void requestSync() {
        try {
            syncExecutor.execute(this::sync);
        } catch (RejectedExecutionException e) {
            log.debug("Farm stopped, ignoring record change");
        }
    }

    /**
     * Start controllers for new records and stop controllers whose record is gone.
     */
    void sync() {
        syncTimer.record(this::syncRecords);
    }

    private void syncRecords() {
        List<RcRecord> records;
        try {
            records = rcStore.list();
        } catch (StoreException e) {
            log.error("Failed to list replication controllers: {}", e.getMessage(), e);
            return;
        }

        Set<String> present = new HashSet<>();
        for (RcRecord record : records) {
            present.add(record.getId());
            if (!controllers.containsKey(record.getId())) {
                startController(record.getId());
            }
        }
        for (String rcId : new ArrayList<>(controllers.keySet())) {
            if (!present.contains(rcId)) {
                log.info("Replication controller {} was deleted", rcId);
                stopController(rcId);
            }
        }
    }

    /**
     * Take the record's lock and start its desire watch. A lock held elsewhere is not an
     * error: the other holder runs the controller.
     */
    void startController(String rcId) {
        HeldLock lock;
        try {
            lock = locker.lock(paths.rcLockPath(rcId));
        } catch (LockException e) {
            log.debug("Replication controller {} is run elsewhere: {}", rcId, e.getMessage());
            return;
        }

        try {
            ReplicationController controller = new ReplicationController(
                rcId, rcStore, scheduler, podStore, applicator, locker, interval);
            DesireWatch watch = controller.watchDesires(this::drainErrors);

            // Another process may own the record once our lease is gone
            WatchHandle lockWatcher = locker.watchLock(lock, () -> {
                log.warn("Lock lost for replication controller {}, stopping", rcId);
                new Thread(() -> stopController(rcId), "rc-lock-lost-" + rcId).start();
            });

            controllers.put(rcId, new ManagedController(rcId, controller, watch, lock, lockWatcher));
            managedGauge.set(controllers.size());
            log.info("Started replication controller {} (total: {})", rcId, controllers.size());
        } catch (RuntimeException e) {
            log.error("Failed to start replication controller {}", rcId, e);
            locker.unlock(lock);
        }
    }

    /**
     * Hand the errors of one pass to the status tracker. Errors the full queue dropped
     * still count towards the consecutive error total.
     */
    void drainErrors(DesireWatch watch, int errorCount) {
        List<Throwable> errors = new ArrayList<>();
        watch.errors().drainTo(errors);
        if (errors.isEmpty() && errorCount == 0) {
            statusTracker.recordSuccess(watch.getRcId());
            return;
        }
        errors.forEach(error -> statusTracker.recordError(watch.getRcId(), error));
        int dropped = errorCount - errors.size();
        if (dropped > 0) {
            statusTracker.recordDropped(watch.getRcId(), dropped);
        }
    }

    /**
     * Stop one controller, waiting for its loop to acknowledge before releasing its lock.
     */
    public void stopController(String rcId) {
        ManagedController managed = controllers.remove(rcId);
        if (managed == null) {
            log.debug("Replication controller {} not managed", rcId);
            return;
        }
        log.info("Stopping replication controller {}", rcId);
        awaitStopped(managed);
        release(managed);
        managedGauge.set(controllers.size());
        log.info("Stopped replication controller {} (remaining: {})", rcId, controllers.size());
    }

    /**
     * Signal quit to every loop at once, then wait for each acknowledgement and release
     * the locks.
     */
    @PreDestroy
    public void stopAll() {
        log.info("Stopping all replication controllers");
        synchronized (this) {
            if (recordsWatch != null) {
                recordsWatch.close();
            }
        }
        syncExecutor.shutdownNow();

        List<ManagedController> stopping = new ArrayList<>();
        for (String rcId : new ArrayList<>(controllers.keySet())) {
            ManagedController managed = controllers.remove(rcId);
            if (managed != null) {
                stopping.add(managed);
                signalStop(managed);
            }
        }
        for (ManagedController managed : stopping) {
            awaitStopped(managed);
            release(managed);
        }
        managedGauge.set(0);
        log.info("Stopped {} replication controller(s)", stopping.size());
    }

    private void signalStop(ManagedController managed) {
        try {
            managed.getWatch().stop(Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitStopped(ManagedController managed) {
        try {
            managed.getWatch().stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted waiting for replication controller {} to stop", managed.getRcId(), e);
        }
    }

    private void release(ManagedController managed) {
        managed.getLockWatcher().close();
        locker.unlock(managed.getLock());
        statusTracker.remove(managed.getRcId());
    }

    public Optional<ReplicationController> controller(String rcId) {
        ManagedController managed = controllers.get(rcId);
        return managed == null ? Optional.empty() : Optional.of(managed.getController());
    }

    public boolean isManaged(String rcId) {
        return controllers.containsKey(rcId);
    }

    public Set<String> getManagedControllers() {
        return new HashSet<>(controllers.keySet());
    }
}
