package io.monitorselector.selection.rules;

import io.monitorselector.enums.MonitorStatus;
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
 * Promotes candidates into spare testing capacity (globally active ones first), then replaces
 * testing monitors that a candidate clearly outperforms.
 *
 * An empty testing pool is left to {@link BootstrapPromotionRule}.
 */
@Slf4j
public class CandidateToTestingPromotionRule implements SelectionRule {

    static final String REASON = "candidate to testing";
    static final int MAX_CAPACITY_PROMOTIONS = 2;

    private final PromotionGate promotionGate;
    private final PerformanceReplacer replacer;

    public CandidateToTestingPromotionRule(PromotionGate promotionGate, PerformanceReplacer replacer) {
        this.promotionGate = promotionGate;
        this.replacer = replacer;
    }

    @Override
    public String getName() {
        return "candidate-to-testing";
    }

    @Override
    public List<StatusChange> apply(RuleContext context) {
        List<EvaluatedMonitor> candidates = context.getCandidateMonitors();
        int budget = context.getLimits().getPromotions();
        if (budget <= 0 || candidates.isEmpty()) {
            return List.of();
        }
        if (context.getTestingCount() == 0) {
            log.debug("No testing monitors on server {}, leaving candidates to bootstrap", context.getServer().getId());
            return List.of();
        }

        List<StatusChange> changes = new ArrayList<>();
        int dynamicTarget = context.dynamicTestingTarget();
        int capacity = Math.max(0, dynamicTarget - context.getTestingCount());
        int promotionsNeeded = Math.min(Math.min(budget, MAX_CAPACITY_PROMOTIONS), capacity);

        log.debug("Candidate promotion on server {}: budget={}, candidates={}, testing={}, dynamicTarget={}, capacity={}",
                context.getServer().getId(), budget, candidates.size(), context.getTestingCount(), dynamicTarget, capacity);

        String emergencyReason = PromotionGate.emergencyReason(REASON, ServerScoreStatus.TESTING, false);
        for (MonitorStatus global : new MonitorStatus[]{MonitorStatus.ACTIVE, MonitorStatus.TESTING}) {
            for (EvaluatedMonitor em : candidates) {
                if (changes.size() >= promotionsNeeded) {
                    break;
                }
                if (em.getMonitor().getGlobalStatus() != global || context.isTouched(em.getId())) {
                    continue;
                }
                if (em.getMonitor().getCount() < context.getSettings().getMinCountForTesting()) {
                    continue;
                }
                promotionGate.attempt(context, em, ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING,
                        REASON, emergencyReason).ifPresent(changes::add);
            }
        }

        int remaining = budget - changes.size();
        if (remaining > 0 && !context.getTestingMonitors().isEmpty()) {
            List<StatusChange> replacements = replacer.replace(context, candidates, context.getTestingMonitors(),
                    remaining, ReplacementType.CANDIDATE_TO_TESTING);
            if (!replacements.isEmpty()) {
                log.info("Candidate replacements planned on server {}: swaps={}",
                        context.getServer().getId(), replacements.size() / 2);
            }
            changes.addAll(replacements);
        }
        return changes;
    }
}
