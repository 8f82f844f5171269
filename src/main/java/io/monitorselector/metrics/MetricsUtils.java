package io.monitorselector.metrics;

import io.monitorselector.models.MonitorCandidate;

import java.util.HashMap;
import java.util.Map;

import static io.monitorselector.metrics.MetricsConstants.MONITOR_ID_TOKEN_TAG;
import static io.monitorselector.metrics.MetricsConstants.MONITOR_TLS_NAME_TAG;
import static io.monitorselector.metrics.MetricsConstants.SERVER_ID_TAG;
import static io.monitorselector.metrics.MetricsConstants.UNKNOWN_LABEL;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    /**
     * Builds a map of metrics tags holding the server id.
     *
     * @param serverId the server id
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildServerTags(long serverId) {
        Map<String, String> tags = new HashMap<>();
        tags.put(SERVER_ID_TAG, String.valueOf(serverId));
        return tags;
    }

    /**
     * Builds a map of metrics tags identifying a monitor on a server. Missing monitor
     * labels are reported as "unknown".
     *
     * @param monitor the monitor, may be null
     * @param serverId the server id
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildMonitorTags(MonitorCandidate monitor, long serverId) {
        Map<String, String> tags = buildServerTags(serverId);
        tags.put(MONITOR_ID_TOKEN_TAG, labelOrUnknown(monitor == null ? null : monitor.getIdToken()));
        tags.put(MONITOR_TLS_NAME_TAG, labelOrUnknown(monitor == null ? null : monitor.getTlsName()));
        return tags;
    }

    static String labelOrUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN_LABEL : value;
    }
}
