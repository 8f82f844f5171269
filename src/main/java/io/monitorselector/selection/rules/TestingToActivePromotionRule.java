package io.monitorselector.selection.rules;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.PerformanceReplacer;
import io.monitorselector.selection.PromotionGate;
import io.monitorselector.selection.ReplacementType;
import io.monitorselector.selection.RuleContext;
import io.monitorselector.selection.SelectionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills the committee from the testing pool, best performer first, then swaps testing monitors
 * that clearly outperform an active one. Consumes the promotions budget.
 */
@Slf4j
public class TestingToActivePromotionRule implements SelectionRule {

    static final String REASON = "promotion to active";

    private final PromotionGate promotionGate;
    private final PerformanceReplacer replacer;

    public TestingToActivePromotionRule(PromotionGate promotionGate, PerformanceReplacer replacer) {
        this.promotionGate = promotionGate;
        this.replacer = replacer;
    }

    @Override
    public String getName() {
        return "testing-to-active";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        List<StatusChange> changes = new ArrayList<>();
        int budget = context.getLimits().getPromotions();
        int toAdd = Math.max(0, context.getTargetActive() - context.getActiveCount());

        if (toAdd > 0 && budget > 0) {
            int promotionsNeeded = Math.min(toAdd, budget);
            if (context.isEmergencyOverride()) {
                log.warn("Emergency override on server {}: zero active monitors, ignoring constraints for promotion "
                        + "(testing monitors: {})", context.getServer().getId(), context.getTestingMonitors().size());
            }

            String emergencyReason = PromotionGate.emergencyReason(REASON, ServerScoreStatus.ACTIVE, false);
            for (EvaluatedMonitor em : context.getTestingMonitors()) {
                if (changes.size() >= promotionsNeeded) {
                    break;
                }
                if (context.isTouched(em.getId())) {
                    continue;
                }
                if (em.getMonitor().getCount() < context.getSettings().getMinCountForActive()) {
                    continue;
                }
                promotionGate.attempt(context, em, ServerScoreStatus.TESTING, ServerScoreStatus.ACTIVE,
                        REASON, emergencyReason).ifPresent(changes::add);
            }
        }

        int remaining = budget - changes.size();
        if (context.getSettings().isActiveSwapEnabled() && remaining > 0
                && !context.getTestingMonitors().isEmpty() && !context.getActiveMonitors().isEmpty()) {
            List<StatusChange> swaps = replacer.replace(context, context.getTestingMonitors(),
                    context.getActiveMonitors(), remaining, ReplacementType.TESTING_TO_ACTIVE);
            if (!swaps.isEmpty()) {
                log.info("Active-testing swaps planned on server {}: swaps={}", context.getServer().getId(), swaps.size() / 2);
            }
            changes.addAll(swaps);
        }

        context.getLimits().setPromotions(Math.max(0, budget - changes.size()));
        return changes;
    }
}
