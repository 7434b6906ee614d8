package io.podcontroller.store;

import io.podcontroller.models.PodManifest;

import java.util.List;
import java.util.Optional;

/**
 * Pod entries in the intent, reality and hook trees. Writes are per-key atomic: two
 * writers racing on the same pod path cannot both succeed against the same prior state.
 */
public interface PodStore {

    /**
     * Write the manifest at {@code <tree>/<node>/<manifest id>}.
     */
    void setPod(PodTree tree, String nodeName, PodManifest manifest) throws StoreException;

    Optional<PodManifest> getPod(PodTree tree, String nodeName, String podId) throws StoreException;

    /**
     * All pods below a node path (or the hooks tree).
     */
    List<PodManifest> listPods(PodTree tree, String nodeName) throws StoreException;

    /**
     * Remove a pod entry. Removing an absent entry is not an error.
     */
    void deletePod(PodTree tree, String nodeName, String podId) throws StoreException;
}
