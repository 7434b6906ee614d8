package io.podcontroller.labels;

import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads and writes labels on nodes, pods and replication controllers.
 * Last write wins per key. An entity without labels reads as an empty mapping.
 */
public interface Applicator {

    void setLabel(LabelType type, String id, String key, String value) throws StoreException;

    void setLabels(LabelType type, String id, Map<String, String> labels) throws StoreException;

    Labeled getLabels(LabelType type, String id) throws StoreException;

    void removeLabel(LabelType type, String id, String key) throws StoreException;

    void removeLabels(LabelType type, String id, Collection<String> keys) throws StoreException;

    void removeAllLabels(LabelType type, String id) throws StoreException;

    /**
     * All entities of the given type whose labels satisfy the selector.
     */
    List<Labeled> getMatches(LabelSelector selector, LabelType type) throws StoreException;

    /**
     * Deliver the current matches to {@code listener} now and again after every change to
     * labels of the given type, until the handle is closed. Query failures are logged and
     * the next change triggers a fresh query.
     */
    WatchHandle watchMatches(LabelSelector selector, LabelType type, Consumer<List<Labeled>> listener);
}
