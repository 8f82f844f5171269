package io.monitorselector.metrics;

import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.StatusChange;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

import static io.monitorselector.metrics.MetricsConstants.*;

/**
 * Records the selector's per-server series through {@link MetricsProvider}.
 */
@Component
public class SelectorMetrics {

    private final MetricsProvider metricsProvider;

    public SelectorMetrics(MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;
    }

    public void trackStatusChange(MonitorCandidate monitor, StatusChange change, long serverId) {
        Map<String, String> tags = MetricsUtils.buildMonitorTags(monitor, serverId);
        tags.put(FROM_STATUS_TAG, change.getFromStatus().getValue());
        tags.put(TO_STATUS_TAG, change.getToStatus().getValue());
        tags.put(REASON_TAG, change.getReason());
        metricsProvider.counter(STATUS_CHANGES_METRIC_NAME, tags).increment();
    }

    public void trackConstraintViolation(MonitorCandidate monitor, ViolationType type, long serverId, boolean grandfathered) {
        Map<String, String> tags = MetricsUtils.buildMonitorTags(monitor, serverId);
        tags.put(CONSTRAINT_TYPE_TAG, type.getValue());
        tags.put(IS_GRANDFATHERED_TAG, String.valueOf(grandfathered));
        metricsProvider.counter(CONSTRAINT_VIOLATIONS_METRIC_NAME, tags).increment();

        Map<String, String> gaugeTags = MetricsUtils.buildMonitorTags(monitor, serverId);
        gaugeTags.put(CONSTRAINT_TYPE_TAG, type.getValue());
        metricsProvider.gauge(GRANDFATHERED_VIOLATIONS_METRIC_NAME, grandfathered ? 1 : 0, gaugeTags);
    }

    public void trackMonitorPoolSizes(long serverId, int active, int testing, int candidate) {
        poolSize(serverId, "active", active);
        poolSize(serverId, "testing", testing);
        poolSize(serverId, "candidate", candidate);
    }

    private void poolSize(long serverId, String status, int count) {
        Map<String, String> tags = MetricsUtils.buildServerTags(serverId);
        tags.put(STATUS_TAG, status);
        metricsProvider.gauge(MONITOR_POOL_SIZE_METRIC_NAME, count, tags);
    }

    /**
     * Sets the blocked-monitor gauge for every violation type; types absent from
     * {@code counts} are reset to zero.
     */
    public void trackConstraintBlocked(long serverId, Map<ViolationType, Integer> counts) {
        for (ViolationType type : ViolationType.values()) {
            if (type == ViolationType.NONE) {
                continue;
            }
            Map<String, String> tags = MetricsUtils.buildServerTags(serverId);
            tags.put(CONSTRAINT_TYPE_TAG, type.getValue());
            metricsProvider.gauge(CONSTRAINT_BLOCKED_MONITORS_METRIC_NAME, counts.getOrDefault(type, 0), tags);
        }
    }

    public void recordProcessing(long serverId, Duration duration, int evaluated, int applied, int failed,
                                 int globallyActive) {
        metricsProvider.timer(PROCESS_DURATION_METRIC_NAME, MetricsUtils.buildServerTags(serverId)).record(duration);
        metricsProvider.counter(MONITORS_EVALUATED_METRIC_NAME, MetricsUtils.buildServerTags(serverId)).increment(evaluated);
        metricsProvider.counter(CHANGES_APPLIED_METRIC_NAME, MetricsUtils.buildServerTags(serverId)).increment(applied);
        metricsProvider.counter(CHANGES_FAILED_METRIC_NAME, MetricsUtils.buildServerTags(serverId)).increment(failed);
        metricsProvider.gauge(GLOBALLY_ACTIVE_MONITORS_METRIC_NAME, globallyActive, MetricsUtils.buildServerTags(serverId));
    }
}
