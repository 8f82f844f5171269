package io.monitorselector.processing;

import io.monitorselector.config.SelectorConfig;
import io.monitorselector.constraints.AccountLimitPolicy;
import io.monitorselector.constraints.ConstraintEngine;
import io.monitorselector.constraints.ConstraintRequest;
import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.metrics.SelectorMetrics;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ProcessResult;
import io.monitorselector.models.ServerInfo;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.GrandfatheringPolicy;
import io.monitorselector.selection.SelectionPlan;
import io.monitorselector.selection.SelectionRuleEngine;
import io.monitorselector.selection.StateClassifier;
import io.monitorselector.store.MonitorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reviews one server: loads its assignments, classifies every monitor, plans the rule
 * engine's changes, writes them and schedules the next review.
 *
 * Must be called inside a transaction; the caller decides whether it commits.
 */
@Slf4j
public class ServerProcessor {

    private final MonitorStore store;
    private final ConstraintEngine constraintEngine;
    private final AccountLimitPolicy accountLimitPolicy;
    private final GrandfatheringPolicy grandfatheringPolicy;
    private final StateClassifier stateClassifier;
    private final SelectionRuleEngine ruleEngine;
    private final ViolationTracker violationTracker;
    private final SelectorMetrics metrics;
    private final SelectorConfig config;
    private final Clock clock;

    public ServerProcessor(MonitorStore store,
                           ConstraintEngine constraintEngine,
                           AccountLimitPolicy accountLimitPolicy,
                           GrandfatheringPolicy grandfatheringPolicy,
                           StateClassifier stateClassifier,
                           SelectionRuleEngine ruleEngine,
                           ViolationTracker violationTracker,
                           SelectorMetrics metrics,
                           SelectorConfig config,
                           Clock clock) {
        this.store = store;
        this.constraintEngine = constraintEngine;
        this.accountLimitPolicy = accountLimitPolicy;
        this.grandfatheringPolicy = grandfatheringPolicy;
        this.stateClassifier = stateClassifier;
        this.ruleEngine = ruleEngine;
        this.violationTracker = violationTracker;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Process one server.
     *
     * @param force process even when the server is not due (single-server runs)
     * @throws io.monitorselector.store.ServerNotFoundException when the server is gone
     * @throws SelectionCancelledException when the thread is interrupted between changes
     */
    public ProcessResult process(long serverId, boolean force) {
        long startNanos = System.nanoTime();
        Instant now = clock.instant();
        log.debug("Processing server {}", serverId);

        boolean due = store.lockServerForReview(serverId, now);
        if (!due && !force) {
            log.debug("Server {} is no longer due for review, skipping", serverId);
            return ProcessResult.skipped(serverId);
        }

        ServerInfo server = store.getServer(serverId);
        List<MonitorCandidate> assignments = store.getMonitorPriority(serverId, now.minus(config.getTelemetryWindow()));

        Map<Long, AccountLimit> accountLimits = accountLimitPolicy.buildLimits(assignments);
        Map<Long, ConstraintViolation> excessHolders = accountLimitPolicy.findExcessHolders(assignments, accountLimits);

        List<EvaluatedMonitor> evaluated = new ArrayList<>(assignments.size());
        for (MonitorCandidate monitor : assignments) {
            evaluated.add(evaluate(monitor, server, assignments, excessHolders));
        }

        SelectionPlan plan = ruleEngine.plan(server, evaluated, assignments, accountLimits);

        Map<Long, MonitorCandidate> byId = new HashMap<>();
        assignments.forEach(m -> byId.put(m.getId(), m));

        int applied = 0;
        int failed = 0;
        Map<Long, ServerScoreStatus> appliedStatus = new HashMap<>();
        for (StatusChange change : plan.getChanges()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SelectionCancelledException(serverId);
            }
            try {
                store.updateServerScoreStatus(serverId, change.getMonitorId(), change.getToStatus());
                applied++;
                appliedStatus.put(change.getMonitorId(), change.getToStatus());
                metrics.trackStatusChange(byId.get(change.getMonitorId()), change, serverId);
                log.info("Applied status change: server={}, monitor={}, from={}, to={}, reason={}",
                        serverId, change.getMonitorId(), change.getFromStatus().getValue(),
                        change.getToStatus().getValue(), change.getReason());
            } catch (DataAccessException e) {
                failed++;
                log.error("Failed to apply status change: server={}, monitor={}, from={}, to={}: {}",
                        serverId, change.getMonitorId(), change.getFromStatus().getValue(),
                        change.getToStatus().getValue(), e.getMessage(), e);
            }
        }

        List<StatusChange> pauses = violationTracker.reconcile(serverId, evaluated, appliedStatus);
        for (StatusChange pause : pauses) {
            metrics.trackStatusChange(byId.get(pause.getMonitorId()), pause, serverId);
            // a row already changed this pass counts once
            if (!appliedStatus.containsKey(pause.getMonitorId())) {
                applied++;
            }
        }

        recordMetrics(serverId, evaluated, startNanos, applied, failed);

        boolean changed = applied > 0;
        Duration interval = changed ? config.getChangedReviewInterval() : config.getUnchangedReviewInterval();
        store.updateServersMonitorReview(serverId, now, now.plus(interval), changed);

        log.info("Server processing complete: server={}, assignedMonitors={}, plannedChanges={}, appliedChanges={}, failedChanges={}, paused={}",
                serverId, assignments.size(), plan.getChanges().size(), applied, failed, pauses.size());

        List<StatusChange> allChanges = new ArrayList<>(plan.getChanges());
        allChanges.addAll(pauses);
        return new ProcessResult(serverId, false, evaluated.size(), allChanges, applied, failed);
    }

    EvaluatedMonitor evaluate(MonitorCandidate monitor, ServerInfo server, List<MonitorCandidate> assignments,
                              Map<Long, ConstraintViolation> excessHolders) {
        ConstraintViolation violation = excessHolders.get(monitor.getId());
        if (violation == null) {
            violation = constraintEngine.checkExcludingLimits(ConstraintRequest.builder()
                    .monitor(monitor)
                    .server(server)
                    .assignedMonitors(assignments)
                    .targetStatus(monitor.getServerStatus())
                    .accountLimits(Map.of())
                    .build());
        }

        if (violation.isPresent()) {
            violation = violation.withGrandfathered(grandfatheringPolicy.isGrandfathered(monitor, violation));
            metrics.trackConstraintViolation(monitor, violation.getType(), server.getId(), violation.isGrandfathered());
        }

        CandidateState state = stateClassifier.classify(monitor, violation);
        return new EvaluatedMonitor(monitor, violation, state);
    }

    private void recordMetrics(long serverId, List<EvaluatedMonitor> evaluated, long startNanos, int applied, int failed) {
        int active = 0;
        int testing = 0;
        int candidate = 0;
        int globallyActive = 0;
        Map<ViolationType, Integer> blocked = new EnumMap<>(ViolationType.class);

        for (EvaluatedMonitor em : evaluated) {
            MonitorCandidate monitor = em.getMonitor();
            if (monitor.getServerStatus() == ServerScoreStatus.ACTIVE) active++;
            if (monitor.getServerStatus() == ServerScoreStatus.TESTING) testing++;
            if (monitor.getServerStatus() == ServerScoreStatus.CANDIDATE) candidate++;
            if (monitor.getGlobalStatus() == MonitorStatus.ACTIVE) globallyActive++;
            if (em.hasViolation()) {
                blocked.merge(em.getViolation().getType(), 1, Integer::sum);
            }
        }

        metrics.trackMonitorPoolSizes(serverId, active, testing, candidate);
        metrics.trackConstraintBlocked(serverId, blocked);
        metrics.recordProcessing(serverId, Duration.ofNanos(System.nanoTime() - startNanos),
                evaluated.size(), applied, failed, globallyActive);
    }
}
