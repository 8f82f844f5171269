package io.monitorselector.selection.rules;

import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.RuleContext;
import io.monitorselector.selection.SelectionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains monitors classified out: active to testing, then testing to candidate, worst
 * performer first and within the removal budgets.
 *
 * Removals for performance alone are refused when they would take a pool to its safe
 * threshold; constraint violations are still removed.
 */
@Slf4j
public class GradualRemovalRule implements SelectionRule {

    static final String REASON = "gradual removal (health or constraints)";

    @Override
    public String getName() {
        return "gradual-removal";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        int activeCount = context.getActiveMonitors().size();

        List<StatusChange> changes = new ArrayList<>(processRemovals(context, context.getActiveMonitors(),
                ServerScoreStatus.ACTIVE, ServerScoreStatus.TESTING,
                activeCount,
                Math.max(1, context.getTargetActive() - 2),
                context.getActiveRemovalBudget(),
                context.isProtectActivePerformance()));

        int testingCount = context.getTestingMonitors().size();
        for (StatusChange change : changes) {
            if (change.getToStatus() == ServerScoreStatus.TESTING) {
                testingCount++;
            }
        }

        changes.addAll(processRemovals(context, context.getTestingMonitors(),
                ServerScoreStatus.TESTING, ServerScoreStatus.CANDIDATE,
                testingCount,
                Math.max(1, context.getSettings().getBaseTesting() - 2),
                context.getLimits().getTestingRemovals(),
                false));
        return changes;
    }

    private List<StatusChange> processRemovals(RuleContext context, List<EvaluatedMonitor> monitors,
                                               ServerScoreStatus from, ServerScoreStatus to,
                                               int currentCount, int safeThreshold, int removalLimit,
                                               boolean protectPerformance) {
        int constraintViolations = 0;
        int performanceIssues = 0;
        for (EvaluatedMonitor em : monitors) {
            if (!em.isState(CandidateState.OUT) || context.isTouched(em.getId())) {
                continue;
            }
            if (em.hasViolation()) {
                constraintViolations++;
            } else {
                performanceIssues++;
            }
        }
        int totalIssues = constraintViolations + performanceIssues;
        if (totalIssues == 0) {
            return List.of();
        }

        boolean skipPerformance = performanceIssues > 0
                && (protectPerformance || currentCount - constraintViolations <= safeThreshold);

        int allowed = removalLimit(context, from, currentCount, safeThreshold, removalLimit,
                constraintViolations, performanceIssues, skipPerformance);
        if (allowed <= 0) {
            return List.of();
        }

        List<StatusChange> changes = new ArrayList<>();
        for (int i = monitors.size() - 1; i >= 0 && allowed > 0; i--) {
            EvaluatedMonitor em = monitors.get(i);
            if (!em.isState(CandidateState.OUT) || context.isTouched(em.getId())) {
                continue;
            }
            if (skipPerformance && !em.hasViolation()) {
                continue;
            }
            StatusChange change = new StatusChange(em.getId(), from, to, REASON);
            context.record(change, em.getMonitor().getAccountId());
            changes.add(change);
            allowed--;
        }
        return changes;
    }

    private int removalLimit(RuleContext context, ServerScoreStatus from, int currentCount, int safeThreshold,
                             int removalLimit, int constraintViolations, int performanceIssues,
                             boolean skipPerformance) {
        int totalIssues = constraintViolations + performanceIssues;

        // with no active monitors the testing pool may be cleaned up aggressively
        if (from == ServerScoreStatus.TESTING && context.getActiveMonitors().isEmpty() && currentCount > safeThreshold) {
            return Math.min(Math.min(totalIssues, removalLimit), currentCount - safeThreshold);
        }

        if ((currentCount <= safeThreshold && constraintViolations == 0)
                || (skipPerformance && constraintViolations == 0)) {
            log.warn("Skipping {} monitor removal due to safety threshold on server {}: current={}, safeThreshold={}, "
                            + "performanceRemovals={}, constraintViolations={}",
                    from.getValue(), context.getServer().getId(), currentCount, safeThreshold,
                    performanceIssues, constraintViolations);
            return 0;
        }

        if (constraintViolations > 0 && (currentCount <= safeThreshold || skipPerformance)) {
            return Math.min(removalLimit, constraintViolations);
        }

        return Math.min(removalLimit, currentCount - safeThreshold);
    }
}
