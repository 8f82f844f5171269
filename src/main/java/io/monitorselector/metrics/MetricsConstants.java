package io.monitorselector.metrics;

/**
 * Metric names and tags used by the selector. Counters are exported with a {@code _total}
 * suffix and the process timer in seconds.
 */
public class MetricsConstants {
    public final static String STATUS_CHANGES_METRIC_NAME = "selector_status_changes";
    public final static String CONSTRAINT_VIOLATIONS_METRIC_NAME = "selector_constraint_violations";
    public final static String GRANDFATHERED_VIOLATIONS_METRIC_NAME = "selector_grandfathered_violations";
    public final static String PROCESS_DURATION_METRIC_NAME = "selector_process_duration";
    public final static String MONITORS_EVALUATED_METRIC_NAME = "selector_monitors_evaluated";
    public final static String CHANGES_APPLIED_METRIC_NAME = "selector_changes_applied";
    public final static String CHANGES_FAILED_METRIC_NAME = "selector_changes_failed";
    public final static String MONITOR_POOL_SIZE_METRIC_NAME = "selector_monitor_pool_size";
    public final static String GLOBALLY_ACTIVE_MONITORS_METRIC_NAME = "selector_globally_active_monitors";
    public final static String CONSTRAINT_BLOCKED_MONITORS_METRIC_NAME = "selector_constraint_blocked_monitors";

    public final static String MONITOR_ID_TOKEN_TAG = "monitor_id_token";
    public final static String MONITOR_TLS_NAME_TAG = "monitor_tls_name";
    public final static String FROM_STATUS_TAG = "from_status";
    public final static String TO_STATUS_TAG = "to_status";
    public final static String SERVER_ID_TAG = "server_id";
    public final static String REASON_TAG = "reason";
    public final static String CONSTRAINT_TYPE_TAG = "constraint_type";
    public final static String IS_GRANDFATHERED_TAG = "is_grandfathered";
    public final static String STATUS_TAG = "status";

    public final static String UNKNOWN_LABEL = "unknown";

    private MetricsConstants() {}
}
