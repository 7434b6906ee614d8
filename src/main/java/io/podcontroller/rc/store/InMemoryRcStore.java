package io.podcontroller.rc.store;

import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelType;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.store.ConflictException;
import io.podcontroller.store.NotFoundException;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * RcStore held in process memory. Mutations are serialized on the store; watchers are
 * notified on the mutating thread once the change is visible.
 */
@Slf4j
public class InMemoryRcStore implements RcStore {

    private final Applicator applicator;
    private final PodStore podStore;
    private final Map<String, RcRecord> records = new HashMap<>();
    private final List<RecordWatcher> watchers = new CopyOnWriteArrayList<>();

    public InMemoryRcStore(Applicator applicator, PodStore podStore) {
        this.applicator = applicator;
        this.podStore = podStore;
    }

    @Override
    public RcRecord create(PodManifest manifest, String nodeSelector, Map<String, String> podLabels)
            throws StoreException {
        RcValidation.validateCreate(manifest, nodeSelector);
        RcRecord record = new RcRecord(UUID.randomUUID().toString(), manifest, nodeSelector, podLabels);
        synchronized (this) {
            records.put(record.getId(), record.copy());
        }
        applicator.setLabels(LabelType.RC, record.getId(), record.getPodLabels());
        log.info("Created replication controller {} for pod {}", record.getId(), manifest.getId());
        notifyWatchers(record.getId());
        return record;
    }

    @Override
    public synchronized RcRecord get(String id) throws StoreException {
        return require(id).copy();
    }

    @Override
    public synchronized List<RcRecord> list() {
        List<RcRecord> result = new ArrayList<>();
        records.values().forEach(record -> result.add(record.copy()));
        return result;
    }

    @Override
    public void setDesiredReplicas(String id, int replicas) throws StoreException {
        RcValidation.validateReplicas(replicas);
        synchronized (this) {
            require(id).setReplicasDesired(replicas);
        }
        log.info("Set desired replicas of {} to {}", id, replicas);
        notifyWatchers(id);
    }

    @Override
    public void disable(String id) throws StoreException {
        synchronized (this) {
            RcRecord record = require(id);
            if (record.isDisabled()) {
                return;
            }
            record.setDisabled(true);
        }
        log.info("Disabled replication controller {}", id);
        notifyWatchers(id);
    }

    @Override
    public void delete(String id) throws StoreException {
        synchronized (this) {
            RcRecord record = require(id);
            if (record.getReplicasDesired() > 0) {
                throw new ConflictException("replication controller " + id + " still wants "
                    + record.getReplicasDesired() + " replica(s); scale to 0 before deleting");
            }
            records.remove(id);
        }
        log.info("Deleted replication controller {}", id);
        notifyWatchers(id);
        applicator.removeAllLabels(LabelType.RC, id);
        OwnedPods.release(id, applicator, podStore);
    }

    @Override
    public WatchHandle watch(String id, Runnable onChange) {
        RecordWatcher watcher = new RecordWatcher(id, onChange);
        watchers.add(watcher);
        return () -> watchers.remove(watcher);
    }

    @Override
    public WatchHandle watchAll(Runnable onChange) {
        return watch(null, onChange);
    }

    private RcRecord require(String id) throws NotFoundException {
        RcRecord record = records.get(id);
        if (record == null) {
            throw new NotFoundException("replication controller " + id + " not found");
        }
        return record;
    }

    private void notifyWatchers(String id) {
        for (RecordWatcher watcher : watchers) {
            if (watcher.id == null || watcher.id.equals(id)) {
                try {
                    watcher.onChange.run();
                } catch (RuntimeException e) {
                    log.error("Replication controller watcher failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    private static final class RecordWatcher {
        private final String id;
        private final Runnable onChange;

        RecordWatcher(String id, Runnable onChange) {
            this.id = id;
            this.onChange = onChange;
        }
    }
}
