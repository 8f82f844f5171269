package io.monitorselector.selection.rules;

import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.RuleContext;
import io.monitorselector.selection.SelectionRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Demotes every blocked active or testing monitor to candidate. Not budget limited.
 */
public class ImmediateBlockingRule implements SelectionRule {

    static final String REASON = "blocked by constraints or global status";

    @Override
    public String getName() {
        return "immediate-blocking";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        List<StatusChange> changes = new ArrayList<>();
        block(context, context.getActiveMonitors(), ServerScoreStatus.ACTIVE, changes);
        block(context, context.getTestingMonitors(), ServerScoreStatus.TESTING, changes);
        return changes;
    }

    private void block(RuleContext context, List<EvaluatedMonitor> monitors, ServerScoreStatus from,
                       List<StatusChange> changes) {
        for (EvaluatedMonitor em : monitors) {
            if (em.isState(CandidateState.BLOCK) && !context.isTouched(em.getId())) {
                StatusChange change = new StatusChange(em.getId(), from, ServerScoreStatus.CANDIDATE, REASON);
                context.record(change, em.getMonitor().getAccountId());
                changes.add(change);
            }
        }
    }
}
