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
 * Demotes the worst healthy actives to testing while the committee is above target. Budget
 * still needed for pending constraint demotions is held back.
 */
@Slf4j
public class ActiveExcessDemotionRule implements SelectionRule {

    static final String REASON = "excess active demotion";

    @Override
    public String getName() {
        return "active-excess-demotion";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        int target = context.getTargetActive();
        int budget = context.getActiveRemovalBudget();
        int demotionsSoFar = context.countChanges(ServerScoreStatus.ACTIVE, null);

        if (context.getActiveCount() <= target
                || context.getActiveCount() <= 1
                || context.isEmergencyOverride()
                || budget <= demotionsSoFar) {
            return List.of();
        }

        List<EvaluatedMonitor> active = context.getActiveMonitors();
        int excess = context.getActiveCount() - target;

        int pendingOut = 0;
        for (EvaluatedMonitor em : active) {
            if (em.isState(CandidateState.OUT) && !context.isTouched(em.getId())) {
                pendingOut++;
            }
        }
        int reserved = Math.min(pendingOut, budget - demotionsSoFar);
        int available = Math.max(0, budget - demotionsSoFar - reserved);
        int demotionsNeeded = Math.min(excess, available);
        if (demotionsNeeded <= 0) {
            return List.of();
        }

        // worst first, skipping rows that are OUT or already changed this pass
        List<EvaluatedMonitor> selected = new ArrayList<>();
        for (int i = active.size() - 1; i >= 0 && selected.size() < demotionsNeeded; i--) {
            EvaluatedMonitor em = active.get(i);
            if (em.isState(CandidateState.OUT) || context.isTouched(em.getId())) {
                continue;
            }
            selected.add(0, em);
        }

        List<StatusChange> changes = new ArrayList<>();
        for (EvaluatedMonitor em : selected) {
            StatusChange change = new StatusChange(em.getId(), ServerScoreStatus.ACTIVE, ServerScoreStatus.TESTING, REASON);
            context.record(change, em.getMonitor().getAccountId());
            changes.add(change);
        }

        log.info("Demoted excess active monitors on server {}: count={}, newActiveCount={}, newTestingCount={}",
                context.getServer().getId(), changes.size(), context.getActiveCount(), context.getTestingCount());
        return changes;
    }
}
