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
 * Shrinks the testing pool to the dynamic target, demoting the worst healthy testing monitors
 * with whatever testing-removal budget earlier rules left.
 */
@Slf4j
public class TestingPoolTrimRule implements SelectionRule {

    static final String REASON = "excess testing monitors";

    @Override
    public String getName() {
        return "testing-pool-trim";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        int dynamicTarget = context.dynamicTestingTarget();
        int testingCount = context.getTestingCount();
        if (testingCount <= dynamicTarget) {
            return List.of();
        }

        int excess = testingCount - dynamicTarget;
        int used = context.countChanges(ServerScoreStatus.TESTING, ServerScoreStatus.CANDIDATE);
        int demotionsNeeded = Math.min(excess, Math.max(0, context.getLimits().getTestingRemovals() - used));
        if (demotionsNeeded <= 0) {
            return List.of();
        }

        log.info("Demoting excess testing monitors on server {}: currentTesting={}, dynamicTarget={}, demotionsNeeded={}",
                context.getServer().getId(), testingCount, dynamicTarget, demotionsNeeded);

        List<StatusChange> changes = new ArrayList<>();
        List<EvaluatedMonitor> testing = context.getTestingMonitors();
        for (int i = testing.size() - 1; i >= 0 && changes.size() < demotionsNeeded; i--) {
            EvaluatedMonitor em = testing.get(i);
            if (em.isState(CandidateState.OUT) || em.hasViolation() || context.isTouched(em.getId())) {
                continue;
            }
            StatusChange change = new StatusChange(em.getId(), ServerScoreStatus.TESTING, ServerScoreStatus.CANDIDATE, REASON);
            context.record(change, em.getMonitor().getAccountId());
            changes.add(change);
        }
        return changes;
    }
}
