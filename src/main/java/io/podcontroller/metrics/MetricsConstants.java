package io.podcontroller.metrics;

/**
 * Constants for metrics names and tags used in the replication controller.
 */
public class MetricsConstants {
    public final static String WATCH_CONSECUTIVE_ERRORS_METRIC_NAME = "rc_watch_consecutive_errors";
    public final static String WATCH_ERRORS_METRIC_NAME = "rc_watch_errors_total";
    public final static String WATCH_TICKS_METRIC_NAME = "rc_watch_ticks_total";
    public final static String MANAGED_RCS_METRIC_NAME = "rc_farm_managed_controllers";
    public final static String FARM_SYNC_DURATION_METRIC_NAME = "rc_farm_sync_duration";
    public final static String WATCH_NAME_TAG = "watch";

    private MetricsConstants() {}
}
