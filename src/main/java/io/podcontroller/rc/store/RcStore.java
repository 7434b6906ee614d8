package io.podcontroller.rc.store;

import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;

import java.util.List;
import java.util.Map;

/**
 * Persistence for replication controller records.
 */
public interface RcStore {

    // =================================================================
    // RECORD OPERATIONS
    // =================================================================

    /**
     * Create a record with a fresh id, zero desired replicas and scheduling enabled.
     * The replication controller entity is labeled with {@code podLabels}.
     *
     * @throws io.podcontroller.store.ValidationException if the manifest or selector is invalid
     */
    RcRecord create(PodManifest manifest, String nodeSelector, Map<String, String> podLabels) throws StoreException;

    /**
     * @throws io.podcontroller.store.NotFoundException if no record has this id
     */
    RcRecord get(String id) throws StoreException;

    /**
     * All records, in no particular order.
     */
    List<RcRecord> list() throws StoreException;

    /**
     * Atomically replace the desired replica count. Concurrent updates are serialized,
     * never lost.
     *
     * @throws io.podcontroller.store.ValidationException if {@code replicas} is negative
     * @throws io.podcontroller.store.NotFoundException if no record has this id
     */
    void setDesiredReplicas(String id, int replicas) throws StoreException;

    /**
     * Suspend scheduling for the record. Disabling a disabled record is a no-op.
     */
    void disable(String id) throws StoreException;

    /**
     * Remove the record and the labels of its entity, then release every pod still labeled
     * as owned by it: its intent entry is deleted and its labels are removed.
     *
     * @throws io.podcontroller.store.ConflictException if desired replicas is above zero
     * @throws io.podcontroller.store.NotFoundException if no record has this id
     */
    void delete(String id) throws StoreException;

    // =================================================================
    // CHANGE NOTIFICATIONS
    // =================================================================

    /**
     * Invoke {@code onChange} after every change to one record, including its deletion.
     */
    WatchHandle watch(String id, Runnable onChange);

    /**
     * Invoke {@code onChange} after any record is created, changed or deleted.
     */
    WatchHandle watchAll(Runnable onChange);
}
