package io.monitorselector.selection.rules;

import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.PromotionGate;
import io.monitorselector.selection.RuleContext;
import io.monitorselector.selection.SelectionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeds an empty testing pool with up to {@code baseTesting} candidates, healthy ones first.
 * No sample-count gate and no promotions budget apply here.
 */
@Slf4j
public class BootstrapPromotionRule implements SelectionRule {

    static final String HEALTHY_REASON = "bootstrap: promoting healthy candidate";
    static final String REASON = "bootstrap: promoting candidate";

    private final PromotionGate promotionGate;

    public BootstrapPromotionRule(PromotionGate promotionGate) {
        this.promotionGate = promotionGate;
    }

    @Override
    public String getName() {
        return "bootstrap";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        List<EvaluatedMonitor> candidates = context.getCandidateMonitors();
        if (context.getTestingCount() != 0 || candidates.isEmpty()) {
            return List.of();
        }

        int maxPromotions = context.getSettings().getBaseTesting();
        log.info("Bootstrap on server {}: no testing monitors, promoting candidates (available={}, target={})",
                context.getServer().getId(), candidates.size(), maxPromotions);

        List<EvaluatedMonitor> healthy = new ArrayList<>();
        List<EvaluatedMonitor> other = new ArrayList<>();
        for (EvaluatedMonitor em : candidates) {
            MonitorStatus global = em.getMonitor().getGlobalStatus();
            if ((global != MonitorStatus.ACTIVE && global != MonitorStatus.TESTING) || context.isTouched(em.getId())) {
                continue;
            }
            if (em.getMonitor().isHealthy()) {
                healthy.add(em);
            } else {
                other.add(em);
            }
        }

        List<StatusChange> changes = new ArrayList<>();
        promote(context, healthy, HEALTHY_REASON, maxPromotions, changes);
        promote(context, other, REASON, maxPromotions, changes);

        if (changes.isEmpty()) {
            log.warn("Bootstrap: unable to promote any candidates due to constraints on server {} (available={})",
                    context.getServer().getId(), candidates.size());
        }
        return changes;
    }

    private void promote(RuleContext context, List<EvaluatedMonitor> group, String reason, int maxPromotions,
                         List<StatusChange> changes) {
        String emergencyReason = PromotionGate.emergencyReason(reason, ServerScoreStatus.TESTING, true);
        for (EvaluatedMonitor em : group) {
            if (changes.size() >= maxPromotions) {
                return;
            }
            promotionGate.attempt(context, em, ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING,
                    reason, emergencyReason).ifPresent(changes::add);
        }
    }
}
