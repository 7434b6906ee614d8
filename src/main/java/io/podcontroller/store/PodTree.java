package io.podcontroller.store;

import static io.podcontroller.config.Constants.*;

/**
 * Top level subtrees whose leaves are pods.
 */
public enum PodTree {
    INTENT(TREE_INTENT),
    REALITY(TREE_REALITY),
    // Hook pods are not scheduled by host
    HOOKS(TREE_HOOKS);

    private final String root;

    PodTree(String root) {
        this.root = root;
    }

    public String getRoot() {
        return root;
    }

    public boolean isHostAgnostic() {
        return this == HOOKS;
    }
}
