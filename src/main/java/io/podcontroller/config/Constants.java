package io.podcontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final int DEFAULT_STORE_RETRIES = 3;
    public static final int DEFAULT_LABEL_RETRIES = 3;
    public static final long DEFAULT_WATCH_INTERVAL_SECONDS = 5L;
    public static final int DEFAULT_LOCK_TTL_SECONDS = 60;
    public static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String TREE_INTENT = "intent";
    public static final String TREE_REALITY = "reality";
    public static final String TREE_HOOKS = "hooks";
    public static final String TREE_LOCK = "lock";
    public static final String PATH_REPLICATION_CONTROLLERS = "replication_controllers";
    public static final String PATH_LABELS = "labels";

    // Label keys
    public static final String RC_ID_LABEL = "replication_controller_id";

    // Label entity types
    public static final String LABEL_TYPE_NODE = "node";
    public static final String LABEL_TYPE_POD = "pod";
    public static final String LABEL_TYPE_RC = "replication_controller";

    // Node inventory endpoint query parameter
    public static final String NODE_SELECTOR_QUERY_PARAM = "selector";

    // Bounded error channel per watch loop
    public static final int WATCH_ERROR_QUEUE_CAPACITY = 1024;
}
