package io.monitorselector.models;

import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.PauseReason;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-evaluation view of one assignment: the server_scores row joined with the monitor,
 * its account and the telemetry aggregates computed by the store.
 *
 * Lists of candidates returned by the store are ordered best first; selection rules
 * rely on that order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonitorCandidate {

    private long id;

    private String idToken;

    private String tlsName;

    private String ip;

    private Long accountId;

    // raw accounts.flags JSON, may be null
    private String accountFlags;

    private MonitorStatus globalStatus;

    @Builder.Default
    private ServerScoreStatus serverStatus = ServerScoreStatus.NEW;

    private boolean hasMetrics;

    private boolean healthy;

    private double rtt;

    // lower is better, negative when the store could not compute one
    @Builder.Default
    private double priority = -1;

    private long count;

    @Builder.Default
    private ViolationType violationType = ViolationType.NONE;

    private Instant violationSince;

    private Instant lastConstraintCheck;

    private PauseReason pauseReason;

    public boolean hasRecordedViolation() {
        return violationType != null && violationType != ViolationType.NONE;
    }
}
