package io.monitorselector.processing;

import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.PauseReason;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.StatusChange;
import io.monitorselector.store.MonitorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the violation columns of the assignment rows in line with this pass's verdicts.
 *
 * <ul>
 *   <li>A new or changed violation type is written with its start time; an unchanged type keeps it.</li>
 *   <li>A resolved violation is cleared.</li>
 *   <li>An unchangeable violation (same subnet, same account) pauses the assignment.</li>
 *   <li>Paused rows are only re-checked once per recheck interval.</li>
 * </ul>
 *
 * Store failures are logged and never fail the pass.
 */
@Slf4j
public class ViolationTracker {

    static final String PAUSE_REASON_TEXT = "unchangeable constraint violation";

    private final MonitorStore store;
    private final Clock clock;
    private final Duration recheckPausedInterval;

    public ViolationTracker(MonitorStore store, Clock clock, Duration recheckPausedInterval) {
        this.store = store;
        this.clock = clock;
        this.recheckPausedInterval = recheckPausedInterval;
    }

    /**
     * @return the assignments paused by this call
     */
    public List<StatusChange> reconcile(long serverId, List<EvaluatedMonitor> evaluated) {
        return reconcile(serverId, evaluated, Map.of());
    }

    /**
     * @param appliedStatus status written earlier in the same pass, by monitor id
     * @return the assignments paused by this call
     */
    public List<StatusChange> reconcile(long serverId, List<EvaluatedMonitor> evaluated,
                                        Map<Long, ServerScoreStatus> appliedStatus) {
        List<StatusChange> pauses = new ArrayList<>();
        Instant now = clock.instant();

        for (EvaluatedMonitor em : evaluated) {
            MonitorCandidate monitor = em.getMonitor();
            try {
                if (monitor.getServerStatus() == ServerScoreStatus.PAUSED) {
                    recheckPaused(serverId, em, now);
                    continue;
                }

                updateColumns(serverId, monitor, em.getViolation());

                ServerScoreStatus current = appliedStatus.getOrDefault(monitor.getId(), monitor.getServerStatus());
                if (shouldPause(em, current)) {
                    StatusChange pause = new StatusChange(monitor.getId(), current,
                            ServerScoreStatus.PAUSED, PAUSE_REASON_TEXT);
                    store.updateServerScoreStatus(serverId, monitor.getId(), ServerScoreStatus.PAUSED);
                    store.updateServerScorePauseReason(serverId, monitor.getId(), PauseReason.CONSTRAINT_VIOLATION);
                    store.updateServerScoreLastConstraintCheck(serverId, monitor.getId(), now);
                    pauses.add(pause);
                    log.info("Paused assignment with unchangeable constraint violation: server={}, monitor={}, from={}, violation={}, details={}",
                            serverId, monitor.getId(), current.getValue(),
                            em.getViolation().getType().getValue(), em.getViolation().getDetails());
                }
            } catch (DataAccessException e) {
                log.error("Failed to track constraint violation for server {} monitor {}: {}",
                        serverId, monitor.getId(), e.getMessage(), e);
            }
        }
        return pauses;
    }

    boolean shouldPause(EvaluatedMonitor em) {
        return shouldPause(em, em.getMonitor().getServerStatus());
    }

    private boolean shouldPause(EvaluatedMonitor em, ServerScoreStatus current) {
        MonitorStatus global = em.getMonitor().getGlobalStatus();
        return em.hasViolation()
                && em.getViolation().getType().isUnchangeable()
                && current != ServerScoreStatus.PAUSED
                && current != ServerScoreStatus.NEW
                && (global == MonitorStatus.ACTIVE || global == MonitorStatus.TESTING);
    }

    private void updateColumns(long serverId, MonitorCandidate monitor, ConstraintViolation violation) {
        if (violation != null && violation.isPresent()) {
            boolean sameType = monitor.getViolationType() == violation.getType();
            if (!sameType || monitor.getViolationSince() == null) {
                Instant since = violation.getSince() != null ? violation.getSince() : clock.instant();
                store.updateServerScoreConstraintViolation(serverId, monitor.getId(), violation.getType(), since);
                log.debug("Updated constraint violation: server={}, monitor={}, type={}, grandfathered={}",
                        serverId, monitor.getId(), violation.getType().getValue(), violation.isGrandfathered());
            }
        } else if (monitor.hasRecordedViolation()) {
            store.clearServerScoreConstraintViolation(serverId, monitor.getId());
            log.debug("Cleared constraint violation: server={}, monitor={}", serverId, monitor.getId());
        }
    }

    private void recheckPaused(long serverId, EvaluatedMonitor em, Instant now) {
        MonitorCandidate monitor = em.getMonitor();
        Instant lastCheck = monitor.getLastConstraintCheck();
        if (lastCheck != null && lastCheck.plus(recheckPausedInterval).isAfter(now)) {
            return;
        }

        store.updateServerScoreLastConstraintCheck(serverId, monitor.getId(), now);

        boolean stillViolating = em.hasViolation() && em.getViolation().getType().isUnchangeable();
        if (!stillViolating && monitor.hasRecordedViolation()) {
            store.clearServerScoreConstraintViolation(serverId, monitor.getId());
            log.info("Constraint resolved for paused assignment, it can be released: server={}, monitor={}, previousViolation={}, pauseReason={}",
                    serverId, monitor.getId(), monitor.getViolationType().getValue(),
                    monitor.getPauseReason() == null ? PauseReason.CONSTRAINT_VIOLATION.getValue() : monitor.getPauseReason().getValue());
        } else if (stillViolating) {
            log.debug("Paused assignment still violates constraints: server={}, monitor={}, violation={}",
                    serverId, monitor.getId(), em.getViolation().getType().getValue());
        }
    }
}
