package io.monitorselector.selection;

import io.monitorselector.constraints.ConstraintEngine;
import io.monitorselector.constraints.ConstraintRequest;
import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.StatusChange;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-confirms promotion eligibility against the working state of the pass.
 *
 * A promotion needs a clean constraint check for the target status; grandfathering only ever
 * applies to assignments already holding a slot. The emergency override (no active monitors
 * before the pass) skips the constraint check but never the global status requirement.
 */
@Slf4j
public class PromotionGate {

    private final ConstraintEngine constraintEngine;

    public PromotionGate(ConstraintEngine constraintEngine) {
        this.constraintEngine = constraintEngine;
    }

    public boolean canPromoteToActive(MonitorCandidate monitor, RuleContext context,
                                      Map<Long, AccountLimit> limits, List<MonitorCandidate> assignments) {
        if (monitor.getGlobalStatus() != MonitorStatus.ACTIVE) {
            return false;
        }
        if (monitor.isHasMetrics() && !monitor.isHealthy()) {
            return false;
        }
        if (context.isEmergencyOverride()) {
            return true;
        }
        return passes(monitor, context, limits, assignments, ServerScoreStatus.ACTIVE);
    }

    public boolean canPromoteToTesting(MonitorCandidate monitor, RuleContext context,
                                       Map<Long, AccountLimit> limits, List<MonitorCandidate> assignments) {
        if (monitor.getGlobalStatus() != MonitorStatus.ACTIVE && monitor.getGlobalStatus() != MonitorStatus.TESTING) {
            return false;
        }
        if (context.isEmergencyOverride()) {
            return true;
        }
        return passes(monitor, context, limits, assignments, ServerScoreStatus.TESTING);
    }

    /**
     * Check the promotion against the context's working limits and planned assignments and,
     * when allowed, record it.
     *
     * @return the recorded change, empty when the promotion is not allowed
     */
    public Optional<StatusChange> attempt(RuleContext context, EvaluatedMonitor candidate,
                                          ServerScoreStatus from, ServerScoreStatus to,
                                          String baseReason, String emergencyReason) {
        MonitorCandidate monitor = candidate.getMonitor();
        List<MonitorCandidate> assignments = context.assignmentsView();
        Map<Long, AccountLimit> limits = context.getWorkingLimits();

        boolean allowed;
        if (to == ServerScoreStatus.ACTIVE) {
            allowed = canPromoteToActive(monitor, context, limits, assignments);
        } else if (to == ServerScoreStatus.TESTING) {
            allowed = canPromoteToTesting(monitor, context, limits, assignments);
        } else {
            allowed = false;
        }

        if (!allowed) {
            return Optional.empty();
        }

        StatusChange change = new StatusChange(monitor.getId(), from, to,
                context.isEmergencyOverride() ? emergencyReason : baseReason);
        context.record(change, monitor.getAccountId());
        return Optional.of(change);
    }

    private boolean passes(MonitorCandidate monitor, RuleContext context, Map<Long, AccountLimit> limits,
                           List<MonitorCandidate> assignments, ServerScoreStatus target) {
        ConstraintViolation violation = constraintEngine.check(ConstraintRequest.builder()
                .monitor(monitor)
                .server(context.getServer())
                .assignedMonitors(assignments)
                .targetStatus(target)
                .accountLimits(limits)
                .build());
        if (violation.isPresent()) {
            log.debug("Promotion of monitor {} to {} on server {} blocked: {}",
                    monitor.getId(), target.getValue(), context.getServer().getId(), violation.getDetails());
            return false;
        }
        return true;
    }

    /**
     * Reason used when the emergency override applies.
     */
    public static String emergencyReason(String baseReason, ServerScoreStatus to, boolean bootstrap) {
        String prefix = bootstrap ? "bootstrap emergency promotion" : "emergency promotion";
        switch (to) {
            case ACTIVE:
                return prefix + ": zero active monitors";
            case TESTING:
                return prefix + " to testing: zero active monitors";
            default:
                return baseReason;
        }
    }
}
