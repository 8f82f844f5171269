package io.monitorselector.selection;

import io.monitorselector.config.SelectionSettings;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ChangeLimits;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;
import io.monitorselector.models.StatusChange;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state of one selection pass, shared by the rules in order.
 *
 * The monitor lists are the pre-pass snapshot, best first. Counts, the account-limit copy and
 * the planned status of every touched assignment move forward as rules record changes, so a
 * later rule sees what earlier rules decided. A monitor receives at most one change per pass.
 */
@Getter
public class RuleContext {

    private final ServerInfo server;
    private final SelectionSettings settings;
    private final ChangeLimits limits;
    private final boolean emergencyOverride;

    private final List<EvaluatedMonitor> activeMonitors;
    private final List<EvaluatedMonitor> testingMonitors;
    private final List<EvaluatedMonitor> candidateMonitors;

    private final List<MonitorCandidate> assignments;
    private final Map<Long, AccountLimit> workingLimits;

    // active removals allowed after the safety floor
    @Setter
    private int activeRemovalBudget;

    // performance-only active removals are refused this pass
    @Setter
    private boolean protectActivePerformance;

    private int activeCount;
    private int testingCount;

    private final List<StatusChange> changes = new ArrayList<>();
    private final Set<Long> touched = new HashSet<>();
    private final Map<Long, ServerScoreStatus> plannedStatus = new HashMap<>();

    public RuleContext(ServerInfo server,
                       SelectionSettings settings,
                       ChangeLimits limits,
                       List<EvaluatedMonitor> activeMonitors,
                       List<EvaluatedMonitor> testingMonitors,
                       List<EvaluatedMonitor> candidateMonitors,
                       List<MonitorCandidate> assignments,
                       Map<Long, AccountLimit> accountLimits) {
        this.server = server;
        this.settings = settings;
        this.limits = limits;
        this.activeMonitors = Collections.unmodifiableList(activeMonitors);
        this.testingMonitors = Collections.unmodifiableList(testingMonitors);
        this.candidateMonitors = Collections.unmodifiableList(candidateMonitors);
        this.assignments = Collections.unmodifiableList(assignments);
        this.emergencyOverride = activeMonitors.isEmpty();
        this.activeCount = activeMonitors.size();
        this.testingCount = testingMonitors.size();
        this.activeRemovalBudget = limits.getActiveRemovals();

        this.workingLimits = new LinkedHashMap<>();
        accountLimits.forEach((accountId, limit) -> workingLimits.put(accountId, limit.copy()));
    }

    /**
     * Record a planned change and move the working counts and account limits with it.
     */
    public void record(StatusChange change, Long accountId) {
        changes.add(change);
        touched.add(change.getMonitorId());
        plannedStatus.put(change.getMonitorId(), change.getToStatus());

        if (change.getFromStatus() == ServerScoreStatus.ACTIVE) activeCount--;
        if (change.getFromStatus() == ServerScoreStatus.TESTING) testingCount--;
        if (change.getToStatus() == ServerScoreStatus.ACTIVE) activeCount++;
        if (change.getToStatus() == ServerScoreStatus.TESTING) testingCount++;

        applyToLimits(workingLimits, accountId, change.getFromStatus(), change.getToStatus());
    }

    public void record(EvaluatedMonitor monitor, ServerScoreStatus from, ServerScoreStatus to, String reason) {
        record(new StatusChange(monitor.getId(), from, to, reason), monitor.getMonitor().getAccountId());
    }

    public boolean isTouched(long monitorId) {
        return touched.contains(monitorId);
    }

    public int dynamicTestingTarget() {
        return settings.dynamicTestingTarget(activeCount);
    }

    public int getTargetActive() {
        return settings.getTargetActive();
    }

    /**
     * Count changes recorded so far that moved a monitor from {@code from} to {@code to};
     * a null {@code to} matches any other status.
     */
    public int countChanges(ServerScoreStatus from, ServerScoreStatus to) {
        int count = 0;
        for (StatusChange change : changes) {
            if (change.getFromStatus() != from) continue;
            if (to == null ? change.getToStatus() != from : change.getToStatus() == to) {
                count++;
            }
        }
        return count;
    }

    /**
     * Assignment rows with planned statuses applied, used as the "existing monitors" of a
     * constraint check.
     */
    public List<MonitorCandidate> assignmentsView() {
        return assignmentsView(Collections.emptyMap());
    }

    /**
     * Same as {@link #assignmentsView()} with extra hypothetical transitions on top.
     */
    public List<MonitorCandidate> assignmentsView(Map<Long, ServerScoreStatus> hypothetical) {
        if (plannedStatus.isEmpty() && hypothetical.isEmpty()) {
            return assignments;
        }
        List<MonitorCandidate> view = new ArrayList<>(assignments.size());
        for (MonitorCandidate row : assignments) {
            ServerScoreStatus status = hypothetical.getOrDefault(row.getId(), plannedStatus.get(row.getId()));
            view.add(status == null ? row : row.toBuilder().serverStatus(status).build());
        }
        return view;
    }

    /**
     * Copy of the working limits for a simulated transition.
     */
    public Map<Long, AccountLimit> copyWorkingLimits() {
        Map<Long, AccountLimit> copy = new LinkedHashMap<>();
        workingLimits.forEach((accountId, limit) -> copy.put(accountId, limit.copy()));
        return copy;
    }

    static void applyToLimits(Map<Long, AccountLimit> limits, Long accountId,
                              ServerScoreStatus from, ServerScoreStatus to) {
        if (accountId == null) {
            return;
        }
        AccountLimit limit = limits.get(accountId);
        if (limit != null) {
            limit.applyTransition(from, to);
        }
    }
}
