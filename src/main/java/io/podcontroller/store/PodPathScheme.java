package io.podcontroller.store;

import java.nio.file.Paths;

import static io.podcontroller.config.Constants.*;

/**
 * Centralized etcd path scheme for pod trees, locks, replication controllers and labels.
 * Every key the controller reads or writes is built here, so all callers address the same
 * key for the same logical entity.
 * Stateless singleton - no state stored.
 */
public class PodPathScheme {

    private static final PodPathScheme INSTANCE = new PodPathScheme();

    private PodPathScheme() {
        // Private constructor for singleton
    }

    public static PodPathScheme getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // POD TREE PATHS
    // =================================================================

    /**
     * Path holding all pods of one node
     * Pattern: <tree>/<node>, or <tree> for the hooks tree
     */
    public String nodePath(PodTree tree, String nodeName) {
        // hooks are not scheduled by host, so the node is irrelevant for them
        if (tree.isHostAgnostic()) {
            return tree.getRoot();
        }
        if (nodeName == null || nodeName.isEmpty()) {
            throw new IllegalArgumentException("node not specified when computing node path in " + tree.getRoot());
        }
        return Paths.get(tree.getRoot(), nodeName).toString();
    }

    /**
     * Path of one pod
     * Pattern: <tree>/<node>/<pod-id>
     */
    public String podPath(PodTree tree, String nodeName, String podId) {
        String nodePath = nodePath(tree, nodeName);
        if (podId == null || podId.isEmpty()) {
            throw new IllegalArgumentException("pod id not specified when computing pod path in " + tree.getRoot());
        }
        return Paths.get(nodePath, podId).toString();
    }

    /**
     * Path to lock when acting on a pod
     * Pattern: lock/<tree>/<node>/<pod-id>
     */
    public String podLockPath(PodTree tree, String nodeName, String podId) {
        return Paths.get(TREE_LOCK, podPath(tree, nodeName, podId)).toString();
    }

    // =================================================================
    // REPLICATION CONTROLLER PATHS
    // =================================================================

    /**
     * Prefix for all replication controller records
     * Pattern: replication_controllers
     */
    public String rcsPrefix() {
        return PATH_REPLICATION_CONTROLLERS;
    }

    /**
     * Pattern: replication_controllers/<rc-id>
     */
    public String rcPath(String rcId) {
        if (rcId == null || rcId.isEmpty()) {
            throw new IllegalArgumentException("replication controller id not specified");
        }
        return Paths.get(PATH_REPLICATION_CONTROLLERS, rcId).toString();
    }

    /**
     * Lock held by the process running a replication controller's watch loop
     * Pattern: lock/replication_controllers/<rc-id>
     */
    public String rcLockPath(String rcId) {
        return Paths.get(TREE_LOCK, rcPath(rcId)).toString();
    }

    // =================================================================
    // LABEL PATHS
    // =================================================================

    /**
     * Pattern: labels/<type>
     */
    public String labelTypePrefix(String labelType) {
        return Paths.get(PATH_LABELS, labelType).toString();
    }

    /**
     * Label set of one entity. Pod entity ids contain a slash (node/pod-id), so the id
     * always occupies the remainder of the key.
     * Pattern: labels/<type>/<id>
     */
    public String labelPath(String labelType, String entityId) {
        if (entityId == null || entityId.isEmpty()) {
            throw new IllegalArgumentException("entity id not specified when computing label path for " + labelType);
        }
        return labelTypePrefix(labelType) + PATH_DELIMITER + entityId;
    }

    /**
     * Inverse of {@link #labelPath(String, String)} for keys under the type prefix.
     */
    public String entityIdFromLabelPath(String labelType, String key) {
        String prefix = labelTypePrefix(labelType) + PATH_DELIMITER;
        if (!key.startsWith(prefix)) {
            throw new IllegalArgumentException("key " + key + " is not a " + labelType + " label path");
        }
        return key.substring(prefix.length());
    }
}
