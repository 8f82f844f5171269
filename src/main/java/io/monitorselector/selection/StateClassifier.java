package io.monitorselector.selection;

import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a monitor and its constraint verdict to a recommended state for this pass.
 *
 * Global status is checked first, then global/server consistency, then constraints,
 * then health.
 */
@Slf4j
public class StateClassifier {

    public CandidateState classify(MonitorCandidate monitor, ConstraintViolation violation) {
        MonitorStatus global = monitor.getGlobalStatus();
        if (global == null) {
            log.warn("Unknown global monitor status for monitor {}", monitor.getId());
            return CandidateState.BLOCK;
        }

        switch (global) {
            case PENDING:
                // phased out whatever the assignment
                if (monitor.getServerStatus().isCounted()) {
                    log.info("Pending monitor {} will be gradually removed (server status {})",
                            monitor.getId(), monitor.getServerStatus().getValue());
                }
                return CandidateState.OUT;
            case PAUSED:
            case DELETED:
                return CandidateState.BLOCK;
            case TESTING:
            case ACTIVE:
                break;
            default:
                log.warn("Unknown global monitor status {} for monitor {}", global, monitor.getId());
                return CandidateState.BLOCK;
        }

        if (hasStateInconsistency(monitor)) {
            log.warn("Inconsistent monitor state detected: monitor={}, globalStatus={}, serverStatus={}",
                    monitor.getId(), global.getValue(), monitor.getServerStatus().getValue());
            return CandidateState.OUT;
        }

        if (violation != null && violation.isPresent()) {
            if (violation.isGrandfathered()) {
                return CandidateState.OUT;
            }
            if (monitor.getServerStatus() == ServerScoreStatus.NEW) {
                return CandidateState.BLOCK;
            }
            return CandidateState.OUT;
        }

        if (monitor.isHasMetrics() && !monitor.isHealthy()) {
            return CandidateState.OUT;
        }

        // only globally active monitors can become server-active
        if (monitor.getServerStatus() == ServerScoreStatus.TESTING && global != MonitorStatus.ACTIVE) {
            return CandidateState.PENDING;
        }

        return CandidateState.IN;
    }

    /**
     * Globally pending, paused or deleted monitors that still hold an assignment.
     */
    public boolean hasStateInconsistency(MonitorCandidate monitor) {
        MonitorStatus global = monitor.getGlobalStatus();
        ServerScoreStatus status = monitor.getServerStatus();
        if (global == null || status == null) {
            return false;
        }

        switch (global) {
            case PENDING:
                return status == ServerScoreStatus.ACTIVE || status == ServerScoreStatus.TESTING;
            case DELETED:
            case PAUSED:
                return status == ServerScoreStatus.ACTIVE
                        || status == ServerScoreStatus.TESTING
                        || status == ServerScoreStatus.CANDIDATE;
            default:
                return false;
        }
    }
}
