package io.monitorselector.selection.rules;

import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.OutOfOrderDetector;
import io.monitorselector.selection.RuleContext;
import io.monitorselector.selection.SelectionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hook for swapping the best testing monitor with a worse-ranked active one. Detection runs
 * but no changes are emitted; the swap would need its own share of the change budgets.
 */
@Slf4j
public class OutOfOrderRule implements SelectionRule {

    private final OutOfOrderDetector detector;

    public OutOfOrderRule(OutOfOrderDetector detector) {
        this.detector = detector;
    }

    @Override
    public String getName() {
        return "out-of-order";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        Map<Long, Integer> rank = new HashMap<>();
        for (int i = 0; i < context.getAssignments().size(); i++) {
            rank.put(context.getAssignments().get(i).getId(), i);
        }
        List<EvaluatedMonitor> ordered = new ArrayList<>(context.getActiveMonitors());
        ordered.addAll(context.getTestingMonitors());
        ordered.sort(Comparator.comparingInt(em -> rank.getOrDefault(em.getId(), Integer.MAX_VALUE)));

        detector.detect(ordered).ifPresent(pair ->
                log.debug("Out-of-order monitors on server {}: testing {} ranks ahead of active {}, optimization disabled",
                        context.getServer().getId(), pair.getBetterTestingId(), pair.getReplaceActiveId()));
        return List.of();
    }
}
