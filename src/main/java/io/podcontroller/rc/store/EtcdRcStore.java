package io.podcontroller.rc.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.KeyValue;
import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelType;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.store.ConflictException;
import io.podcontroller.store.EtcdOperations;
import io.podcontroller.store.NotFoundException;
import io.podcontroller.store.PodPathScheme;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.RetryPolicy;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * etcd-based RcStore. Each record is a JSON document at {@code replication_controllers/<id>}.
 * Updates read the record, change it and write it back in a transaction that compares the
 * mod revision that was read; a lost race is retried by the {@link RetryPolicy}.
 */
@Slf4j
public class EtcdRcStore implements RcStore {

    private final EtcdOperations etcd;
    private final PodPathScheme paths;
    private final RetryPolicy retryPolicy;
    private final Applicator applicator;
    private final PodStore podStore;
    private final ObjectMapper objectMapper;

    public EtcdRcStore(EtcdOperations etcd, RetryPolicy retryPolicy, Applicator applicator, PodStore podStore) {
        this.etcd = etcd;
        this.paths = PodPathScheme.getInstance();
        this.retryPolicy = retryPolicy;
        this.applicator = applicator;
        this.podStore = podStore;
        this.objectMapper = new ObjectMapper();
    }

    // =================================================================
    // RECORD OPERATIONS
    // =================================================================

    @Override
    public RcRecord create(PodManifest manifest, String nodeSelector, Map<String, String> podLabels)
            throws StoreException {
        RcValidation.validateCreate(manifest, nodeSelector);
        RcRecord record = new RcRecord(UUID.randomUUID().toString(), manifest, nodeSelector, podLabels);
        String key = paths.rcPath(record.getId());

        retryPolicy.run("create replication controller " + key, () -> {
            if (!etcd.putIfAbsent(key, objectMapper.writeValueAsBytes(record))) {
                throw new ConflictException("replication controller " + record.getId() + " already exists");
            }
        });

        try {
            applicator.setLabels(LabelType.RC, record.getId(), record.getPodLabels());
        } catch (StoreException e) {
            log.error("Failed to label replication controller {}, removing record: {}", record.getId(), e.getMessage(), e);
            retryPolicy.run("roll back replication controller " + key, () -> etcd.delete(key));
            throw e;
        }
        log.info("Created replication controller {} for pod {} with selector '{}'",
            record.getId(), manifest.getId(), nodeSelector);
        return record;
    }

    @Override
    public RcRecord get(String id) throws StoreException {
        String key = paths.rcPath(id);
        return retryPolicy.call("read replication controller " + key, () -> parse(requireRecord(id)));
    }

    @Override
    public List<RcRecord> list() throws StoreException {
        return retryPolicy.call("list replication controllers", () -> {
            List<RcRecord> records = new ArrayList<>();
            for (KeyValue kv : etcd.getPrefix(paths.rcsPrefix())) {
                try {
                    records.add(parse(kv));
                } catch (Exception parseException) {
                    log.warn("Failed to parse replication controller at key {}: {}",
                        EtcdOperations.string(kv.getKey()), parseException.getMessage());
                }
            }
            return records;
        });
    }

    @Override
    public void setDesiredReplicas(String id, int replicas) throws StoreException {
        RcValidation.validateReplicas(replicas);
        update(id, "set desired replicas of", record -> record.setReplicasDesired(replicas));
        log.info("Set desired replicas of {} to {}", id, replicas);
    }

    @Override
    public void disable(String id) throws StoreException {
        update(id, "disable", record -> record.setDisabled(true));
        log.info("Disabled replication controller {}", id);
    }

    @Override
    public void delete(String id) throws StoreException {
        String key = paths.rcPath(id);
        retryPolicy.run("delete replication controller " + key, () -> {
            KeyValue kv = requireRecord(id);
            RcRecord record = parse(kv);
            if (record.getReplicasDesired() > 0) {
                throw new ConflictException("replication controller " + id + " still wants "
                    + record.getReplicasDesired() + " replica(s); scale to 0 before deleting");
            }
            // Fails if replicas were raised after the check above
            etcd.deleteAtRevision(key, kv.getModRevision());
        });
        log.info("Deleted replication controller {}", id);
        applicator.removeAllLabels(LabelType.RC, id);
        OwnedPods.release(id, applicator, podStore);
    }

    /**
     * Compare-And-Swap read-modify-write of one record. Unchanged records are not rewritten.
     */
    private void update(String id, String description, Consumer<RcRecord> change) throws StoreException {
        String key = paths.rcPath(id);
        retryPolicy.run(description + " replication controller " + key, () -> {
            KeyValue kv = requireRecord(id);
            RcRecord current = parse(kv);
            RcRecord updated = current.copy();
            change.accept(updated);
            if (updated.equals(current)) {
                return;
            }
            etcd.putAtRevision(key, objectMapper.writeValueAsBytes(updated), kv.getModRevision());
        });
    }

    private KeyValue requireRecord(String id) throws Exception {
        Optional<KeyValue> kv = etcd.get(paths.rcPath(id));
        if (kv.isEmpty()) {
            throw new NotFoundException("replication controller " + id + " not found");
        }
        return kv.get();
    }

    private RcRecord parse(KeyValue kv) throws StoreException {
        try {
            return objectMapper.readValue(kv.getValue().getBytes(), RcRecord.class);
        } catch (Exception e) {
            throw new StoreException("Corrupt replication controller at " + EtcdOperations.string(kv.getKey())
                + ": " + e.getMessage(), e);
        }
    }

    // =================================================================
    // CHANGE NOTIFICATIONS
    // =================================================================

    @Override
    public WatchHandle watch(String id, Runnable onChange) {
        return etcd.watch(paths.rcPath(id), false, onChange);
    }

    @Override
    public WatchHandle watchAll(Runnable onChange) {
        return etcd.watch(paths.rcsPrefix(), true, onChange);
    }
}
